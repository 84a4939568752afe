package info.isaksson.erland.ontoumlcheck.taxonomy;

import java.util.Optional;

/**
 * OntoUML class stereotypes.
 *
 * <p>Classification predicates are exhaustive switches, so adding a constant forces every
 * predicate to decide about it.</p>
 */
public enum ClassStereotype {
    // Sortals
    KIND("kind"),
    SUBKIND("subkind"),
    PHASE("phase"),
    ROLE("role"),
    COLLECTIVE("collective"),
    QUANTITY("quantity"),
    RELATOR("relator"),
    // Non-sortals
    CATEGORY("category"),
    PHASE_MIXIN("phaseMixin"),
    ROLE_MIXIN("roleMixin"),
    MIXIN("mixin"),
    // Aspects
    MODE("mode"),
    QUALITY("quality");

    private final String literal;

    ClassStereotype(String literal) {
        this.literal = literal;
    }

    /** The literal as written between guillemets in a diagram. */
    public String literal() {
        return literal;
    }

    /**
     * Look up a stereotype by its literal. Surrounding whitespace is ignored; matching is
     * case-sensitive. Blank and unknown literals yield empty.
     */
    public static Optional<ClassStereotype> fromLiteral(String literal) {
        if (literal == null) return Optional.empty();
        String s = literal.trim();
        for (ClassStereotype st : values()) {
            if (st.literal.equals(s)) return Optional.of(st);
        }
        return Optional.empty();
    }

    public boolean isRigid() {
        switch (this) {
            case KIND:
            case SUBKIND:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
            case CATEGORY:
            case MODE:
            case QUALITY:
                return true;
            case PHASE:
            case ROLE:
            case PHASE_MIXIN:
            case ROLE_MIXIN:
            case MIXIN:
                return false;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + this);
        }
    }

    /** Mixin is neither rigid nor anti-rigid (semi-rigid). */
    public boolean isAntiRigid() {
        switch (this) {
            case ROLE:
            case PHASE:
            case PHASE_MIXIN:
            case ROLE_MIXIN:
                return true;
            case KIND:
            case SUBKIND:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
            case CATEGORY:
            case MIXIN:
            case MODE:
            case QUALITY:
                return false;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + this);
        }
    }

    public boolean isIdentityProvider() {
        switch (this) {
            case KIND:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
            case QUALITY:
            case MODE:
                return true;
            case SUBKIND:
            case PHASE:
            case ROLE:
            case CATEGORY:
            case PHASE_MIXIN:
            case ROLE_MIXIN:
            case MIXIN:
                return false;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + this);
        }
    }

    /** Whether instances must carry exactly one principle of identity. */
    public boolean requiresIdentity() {
        return !isNonSortal();
    }

    public boolean isSortal() {
        switch (this) {
            case KIND:
            case SUBKIND:
            case PHASE:
            case ROLE:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
                return true;
            case CATEGORY:
            case PHASE_MIXIN:
            case ROLE_MIXIN:
            case MIXIN:
            case MODE:
            case QUALITY:
                return false;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + this);
        }
    }

    public boolean isNonSortal() {
        switch (this) {
            case CATEGORY:
            case PHASE_MIXIN:
            case ROLE_MIXIN:
            case MIXIN:
                return true;
            case KIND:
            case SUBKIND:
            case PHASE:
            case ROLE:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
            case MODE:
            case QUALITY:
                return false;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + this);
        }
    }

    public boolean isAspect() {
        return this == MODE || this == QUALITY;
    }

    @Override
    public String toString() {
        return literal;
    }
}
