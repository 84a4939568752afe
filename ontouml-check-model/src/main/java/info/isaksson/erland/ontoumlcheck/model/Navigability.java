package info.isaksson.erland.ontoumlcheck.model;

/** Navigability marker of one association end. */
public enum Navigability {
    UNSPECIFIED,
    NAVIGABLE,
    NON_NAVIGABLE
}
