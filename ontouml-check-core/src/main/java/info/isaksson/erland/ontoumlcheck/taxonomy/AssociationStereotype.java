package info.isaksson.erland.ontoumlcheck.taxonomy;

import java.util.Optional;

/**
 * OntoUML association stereotypes. {@link #NONE} is a plain, unstereotyped association.
 */
public enum AssociationStereotype {
    NONE(""),
    FORMAL("formal"),
    MEDIATION("mediation"),
    CHARACTERIZATION("characterization"),
    STRUCTURATION("structuration"),
    COMPONENT_OF("componentOf"),
    CONTAINMENT("containment"),
    MEMBER_OF("memberOf"),
    SUBCOLLECTION_OF("subcollectionOf"),
    SUBQUANTITY_OF("subquantityOf");

    private final String literal;

    AssociationStereotype(String literal) {
        this.literal = literal;
    }

    public String literal() {
        return literal;
    }

    /** Same lookup rules as {@link ClassStereotype#fromLiteral(String)}; blank maps to {@link #NONE}. */
    public static Optional<AssociationStereotype> fromLiteral(String literal) {
        if (literal == null) return Optional.of(NONE);
        String s = literal.trim();
        for (AssociationStereotype st : values()) {
            if (st.literal.equals(s)) return Optional.of(st);
        }
        return Optional.empty();
    }

    public boolean isPartWhole() {
        switch (this) {
            case COMPONENT_OF:
            case CONTAINMENT:
            case MEMBER_OF:
            case SUBCOLLECTION_OF:
            case SUBQUANTITY_OF:
                return true;
            case NONE:
            case FORMAL:
            case MEDIATION:
            case CHARACTERIZATION:
            case STRUCTURATION:
                return false;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + this);
        }
    }

    @Override
    public String toString() {
        return literal;
    }
}
