package info.isaksson.erland.ontoumlcheck.validation;

import java.util.Objects;

/**
 * One diagnostic produced by a validation run, keyed by the id of the offending element.
 */
public abstract class ValidationProblem {

    public final String elementId;

    protected ValidationProblem(String elementId) {
        this.elementId = Objects.requireNonNull(elementId, "elementId must not be null");
    }

    public abstract Severity severity();

    /** Stable code: an error kind or an anti-pattern name. */
    public abstract String code();

    /** Text shown to the user next to the problem label. */
    public abstract String text();

    public boolean isError() {
        return severity() == Severity.ERROR;
    }
}
