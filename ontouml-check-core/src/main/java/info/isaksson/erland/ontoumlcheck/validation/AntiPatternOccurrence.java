package info.isaksson.erland.ontoumlcheck.validation;

import java.util.Objects;

/** An anti-pattern found on one element. */
public final class AntiPatternOccurrence extends ValidationProblem {

    public final AntiPatternType type;

    public AntiPatternOccurrence(String elementId, AntiPatternType type) {
        super(elementId);
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    @Override
    public Severity severity() {
        return Severity.ANTI_PATTERN;
    }

    @Override
    public String code() {
        return type.code();
    }

    @Override
    public String text() {
        return type.code();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AntiPatternOccurrence)) return false;
        AntiPatternOccurrence that = (AntiPatternOccurrence) o;
        return elementId.equals(that.elementId) && type == that.type;
    }

    @Override public int hashCode() {
        return Objects.hash(elementId, type);
    }

    @Override public String toString() {
        return type.code() + " [" + elementId + "]";
    }
}
