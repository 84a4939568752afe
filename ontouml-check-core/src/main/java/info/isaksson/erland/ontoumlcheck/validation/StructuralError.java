package info.isaksson.erland.ontoumlcheck.validation;

import java.util.Objects;

/** A well-formedness violation. */
public final class StructuralError extends ValidationProblem {

    public final ErrorKind kind;

    /** Set only for {@link ErrorKind#INVALID_RELATION}. */
    public final RelationIssue relationIssue;

    public final String message;

    public StructuralError(String elementId, ErrorKind kind, RelationIssue relationIssue, String message) {
        super(elementId);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.relationIssue = relationIssue;
        this.message = message == null ? "" : message;
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }

    @Override
    public String code() {
        return relationIssue == null ? kind.code() : kind.code() + "(" + relationIssue.code() + ")";
    }

    @Override
    public String text() {
        return message;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuralError)) return false;
        StructuralError that = (StructuralError) o;
        return elementId.equals(that.elementId) &&
                kind == that.kind &&
                relationIssue == that.relationIssue &&
                message.equals(that.message);
    }

    @Override public int hashCode() {
        return Objects.hash(elementId, kind, relationIssue, message);
    }

    @Override public String toString() {
        return code() + " [" + elementId + "]: " + message;
    }
}
