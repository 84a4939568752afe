package info.isaksson.erland.ontoumlcheck.validation;

/** Structural error categories. Codes are stable across versions. */
public enum ErrorKind {
    INVALID_STEREOTYPE("InvalidStereotype"),
    INVALID_SUBTYPING("InvalidSubtyping"),
    INVALID_RELATION("InvalidRelation"),
    INVALID_IDENTITY("InvalidIdentity"),
    INVALID_ROLE("InvalidRole"),
    INVALID_RELATOR("InvalidRelator"),
    INVALID_PHASE("InvalidPhase"),
    INVALID_NONABSTRACT_MIXIN("InvalidNonabstractMixin"),
    INVALID_MISSING_CHARACTERIZATION("InvalidMissingCharacterization"),
    MISSING_REFERENCE("MissingReference");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
