package info.isaksson.erland.ontoumlcheck.report;

import info.isaksson.erland.ontoumlcheck.core.OntoUmlValidationService;
import info.isaksson.erland.ontoumlcheck.core.ValidationOptions;
import info.isaksson.erland.ontoumlcheck.core.ValidationResult;
import info.isaksson.erland.ontoumlcheck.model.OntoAssociation;
import info.isaksson.erland.ontoumlcheck.model.OntoClass;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.model.OntoModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownReportWriterTest {

    @Test
    void listsCountsAndOneRowPerProblem() {
        OntoModel model = new OntoModel("m", "School", List.of(
                new OntoClass("person", "Person", "kind", false, null),
                new OntoClass("student", "Student", "role", false, null),
                new OntoGeneralization("g1", List.of("student"), List.of("person"), false, false),
                new OntoAssociation("a1", "", "person", "a|b", "student", "")
        ));
        ValidationResult result = new OntoUmlValidationService().validate(model, ValidationOptions.all());

        String md = MarkdownReportWriter.render("School", null, result);

        assertTrue(md.startsWith("# ontouml-check report\n"));
        assertTrue(md.contains("- Check anti-patterns: **true**"), md);
        assertTrue(md.contains("| InvalidRole | 1 |"), md);
        assertTrue(md.contains("| FreeRole | 1 |"), md);
        assertTrue(md.contains("| Error | InvalidRole | `student` | «role» is not mediated by any relator |"), md);
        assertTrue(md.contains("'a\\|b'"), "pipes in messages are escaped: " + md);
        assertFalse(md.contains("Snapshot"));
    }

    @Test
    void emptyResultSaysSo() {
        OntoModel model = new OntoModel("m", "Empty", List.of());
        ValidationResult result = new OntoUmlValidationService().validate(model, new ValidationOptions());

        String md = MarkdownReportWriter.render("Empty", null, result);
        assertTrue(md.contains("No problems found."));
        assertFalse(md.contains("## Problems"));
        assertFalse(md.contains("Detectors"));
    }
}
