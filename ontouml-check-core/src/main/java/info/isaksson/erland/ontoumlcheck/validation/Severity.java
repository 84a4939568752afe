package info.isaksson.erland.ontoumlcheck.validation;

public enum Severity {
    /** Well-formedness violation. */
    ERROR,
    /** Legal but ontologically suspicious structure. */
    ANTI_PATTERN
}
