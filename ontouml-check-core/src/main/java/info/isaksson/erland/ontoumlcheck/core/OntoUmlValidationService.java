package info.isaksson.erland.ontoumlcheck.core;

import info.isaksson.erland.ontoumlcheck.antipattern.AntiPatternValidator;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.model.ElementContainer;
import info.isaksson.erland.ontoumlcheck.model.ModelJson;
import info.isaksson.erland.ontoumlcheck.model.OntoModel;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;
import info.isaksson.erland.ontoumlcheck.validation.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point for validating an OntoUML model.
 *
 * <p>CLI and editor hosts should use this class instead of wiring the validators themselves.
 * Each call indexes the model from scratch; nothing is kept between runs.</p>
 */
public final class OntoUmlValidationService {

    private static final Logger log = LoggerFactory.getLogger(OntoUmlValidationService.class);

    private final StructuralValidator structuralValidator = new StructuralValidator();
    private final AntiPatternValidator antiPatternValidator = new AntiPatternValidator();

    public ValidationResult validate(OntoModel model, ValidationOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        return validate((ElementContainer) model, options);
    }

    /** Validate any element tree, e.g. a single package. */
    public ValidationResult validate(ElementContainer root, ValidationOptions options) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (options == null) options = new ValidationOptions();

        ModelIndex index = ModelIndex.build(root);
        ProblemCollector out = new ProblemCollector();

        if (options.checkErrors) {
            structuralValidator.validate(index, out);
        }
        if (options.checkAntipatterns) {
            antiPatternValidator.validate(index, options.enabledAntiPatterns, out);
        }

        log.debug("Validation finished with {} problem(s) ({})", out.size(), options);
        return new ValidationResult(out.toList(), options);
    }

    /** Read a JSON snapshot and validate it. */
    public ValidationResult validateFile(Path snapshot, ValidationOptions options) throws IOException {
        if (snapshot == null) throw new IllegalArgumentException("snapshot must not be null");
        return validate(ModelJson.read(snapshot), options);
    }
}
