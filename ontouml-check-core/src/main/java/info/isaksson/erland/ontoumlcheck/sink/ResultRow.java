package info.isaksson.erland.ontoumlcheck.sink;

import java.util.Objects;

/**
 * One row of the results table. Activating the row selects {@link #elementId} and pans to it.
 */
public final class ResultRow {

    public static final String ERROR_LABEL = "Error";
    public static final String ANTI_PATTERN_LABEL = "Anti-Pattern";

    /** Shown by hosts when a run produced no rows. */
    public static final String NO_PROBLEMS_TEXT = "No problems found";

    public final String label;
    public final String text;
    public final String elementId;

    public ResultRow(String label, String text, String elementId) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.text = text == null ? "" : text;
        this.elementId = Objects.requireNonNull(elementId, "elementId must not be null");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultRow)) return false;
        ResultRow that = (ResultRow) o;
        return label.equals(that.label) && text.equals(that.text) && elementId.equals(that.elementId);
    }

    @Override public int hashCode() {
        return Objects.hash(label, text, elementId);
    }

    @Override public String toString() {
        return label + ": " + text + " [" + elementId + "]";
    }
}
