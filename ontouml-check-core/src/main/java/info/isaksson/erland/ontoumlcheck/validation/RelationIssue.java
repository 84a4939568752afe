package info.isaksson.erland.ontoumlcheck.validation;

/** Detail of an {@link ErrorKind#INVALID_RELATION} error. */
public enum RelationIssue {
    /** A multiplicity is missing, unparseable, inverted or has the wrong shape for the stereotype. */
    MULTIPLICITIES("Multiplicities"),
    /** An end's stereotype is not allowed for the association stereotype. */
    ENDPOINTS("Endpoints");

    private final String code;

    RelationIssue(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
