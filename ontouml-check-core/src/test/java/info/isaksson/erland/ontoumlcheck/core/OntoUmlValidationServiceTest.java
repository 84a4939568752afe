package info.isaksson.erland.ontoumlcheck.core;

import info.isaksson.erland.ontoumlcheck.TestModels;
import info.isaksson.erland.ontoumlcheck.model.OntoModel;
import info.isaksson.erland.ontoumlcheck.model.OntoPackage;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ErrorKind;
import info.isaksson.erland.ontoumlcheck.validation.ValidationProblem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OntoUmlValidationServiceTest {

    private final OntoUmlValidationService service = new OntoUmlValidationService();

    /** An unmediated role: one InvalidRole error and one FreeRole anti-pattern. */
    private static OntoModel freeRole() {
        return TestModels.model()
                .cls("Person", "kind")
                .cls("Student", "role")
                .gen("g1", "Student", "Person")
                .build();
    }

    @Test
    void defaultsCheckErrorsOnly() {
        ValidationResult result = service.validate(freeRole(), null);

        assertEquals(1, result.problems.size());
        assertEquals(ErrorKind.INVALID_ROLE, result.errors().get(0).kind);
        assertTrue(result.antiPatterns().isEmpty());
    }

    @Test
    void errorsComeBeforeAntiPatterns() {
        ValidationResult result = service.validate(freeRole(), ValidationOptions.all());

        List<ValidationProblem> problems = result.problems;
        assertEquals(2, problems.size());
        assertTrue(problems.get(0).isError());
        assertEquals("FreeRole", problems.get(1).code());
        assertEquals("Student", problems.get(1).elementId);
    }

    @Test
    void antiPatternsOnly() {
        ValidationOptions options = new ValidationOptions();
        options.checkErrors = false;
        options.checkAntipatterns = true;

        ValidationResult result = service.validate(freeRole(), options);

        assertEquals(1, result.problems.size());
        assertEquals(AntiPatternType.FREE_ROLE, result.antiPatterns().get(0).type);
    }

    @Test
    void disabledAntiPatternIsSkipped() {
        ValidationOptions options = ValidationOptions.all();
        options.enabledAntiPatterns = EnumSet.complementOf(EnumSet.of(AntiPatternType.FREE_ROLE));

        assertTrue(service.validate(freeRole(), options).antiPatterns().isEmpty());

        options.enabledAntiPatterns = null;
        assertTrue(service.validate(freeRole(), options).antiPatterns().isEmpty());
    }

    @Test
    void nothingEnabledIsAnEmptyResult() {
        ValidationOptions options = new ValidationOptions();
        options.checkErrors = false;

        ValidationResult result = service.validate(freeRole(), options);
        assertTrue(result.isEmpty());
        assertTrue(result.countsByCode().isEmpty());
    }

    @Test
    void eachRunStartsFresh() {
        OntoModel model = freeRole();
        ValidationResult first = service.validate(model, ValidationOptions.all());
        ValidationResult second = service.validate(model, ValidationOptions.all());
        assertEquals(first.problems, second.problems);
    }

    @Test
    void validatesASinglePackage() {
        OntoPackage pkg = new OntoPackage("p", "p", freeRole().elements);
        assertEquals(1, service.validate(pkg, new ValidationOptions()).errors().size());
    }

    @Test
    void countsByCodeFollowFirstAppearance() {
        OntoModel model = TestModels.model()
                .cls("A", "Kind")
                .cls("B", "")
                .cls("Person", "kind")
                .cls("Student", "role")
                .gen("g1", "Student", "Person")
                .build();

        ValidationResult result = service.validate(model, ValidationOptions.all());
        assertEquals(List.of("InvalidStereotype", "InvalidRole", "FreeRole"), List.copyOf(result.countsByCode().keySet()));
        assertEquals(2, result.countsByCode().get("InvalidStereotype"));
    }

    @Test
    void validatesMarriageSnapshotCleanly() throws IOException {
        Path tmp = Files.createTempFile("ontouml-check-", ".json");
        try (InputStream in = OntoUmlValidationServiceTest.class.getResourceAsStream("/models/marriage.json")) {
            assertNotNull(in, "fixture must exist in test resources");
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
        }

        ValidationResult result = service.validateFile(tmp, ValidationOptions.all());
        assertEquals(List.of(), result.problems);
    }

    @Test
    void rejectsNullModel() {
        assertThrows(IllegalArgumentException.class, () -> service.validate((OntoModel) null, null));
        assertThrows(IllegalArgumentException.class, () -> service.validateFile(null, null));
    }

    @Test
    void deepMultipleInheritanceValidatesQuickly() {
        // A mediated relator at the top, then 30 levels that each specialize both classes above.
        TestModels m = TestModels.model()
                .cls("Enrollment", "relator")
                .cls("Student", "kind")
                .cls("School", "kind")
                .assoc("m1", "mediation", "Enrollment", "1..*", "Student", "1")
                .assoc("m2", "mediation", "Enrollment", "1..*", "School", "1");
        List<String> above = List.of("Enrollment");
        for (int level = 1; level <= 30; level++) {
            String a = "E" + level + "a";
            String b = "E" + level + "b";
            m.cls(a, "subkind").cls(b, "subkind").genSet("g" + level, List.of(a, b), above, false, false);
            above = List.of(a, b);
        }
        OntoModel model = m.build();

        ValidationResult result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> service.validate(model, ValidationOptions.all()));

        assertTrue(result.errors().stream().noneMatch(e -> e.kind == ErrorKind.INVALID_RELATOR));
        assertTrue(result.errors().stream().anyMatch(e -> e.kind == ErrorKind.INVALID_IDENTITY && "E30a".equals(e.elementId)));
    }
}
