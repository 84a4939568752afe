package info.isaksson.erland.ontoumlcheck.sink;

/** How a host marks an element that has a problem. */
public enum HighlightKind {
    /** Structural error. */
    INVALID,
    /** Anti-pattern. */
    WARNING
}
