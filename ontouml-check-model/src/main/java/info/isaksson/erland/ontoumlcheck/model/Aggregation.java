package info.isaksson.erland.ontoumlcheck.model;

/** Aggregation marker of one association end. */
public enum Aggregation {
    NONE,
    SHARED,
    COMPOSITE
}
