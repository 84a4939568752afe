package info.isaksson.erland.ontoumlcheck.taxonomy;

import java.util.Optional;

/**
 * Direct-subtyping legality between class stereotypes.
 *
 * <p>All lookups are total: a literal that is not a known stereotype is never a legal
 * subtype or supertype of anything.</p>
 */
public final class StereotypeTaxonomy {

    private StereotypeTaxonomy() {}

    /** Whether a class stereotyped {@code child} may directly specialize one stereotyped {@code parent}. */
    public static boolean isValidSubtyping(ClassStereotype child, ClassStereotype parent) {
        if (child == null || parent == null) return false;
        switch (child) {
            case KIND:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
            case QUALITY:
            case MODE:
            case CATEGORY:
            case MIXIN:
                return parent == ClassStereotype.CATEGORY || parent == ClassStereotype.MIXIN;
            case SUBKIND:
                return isSortalOrNonSortalSupertype(parent);
            case PHASE:
                return isSortalOrNonSortalSupertype(parent)
                        || parent == ClassStereotype.PHASE
                        || parent == ClassStereotype.PHASE_MIXIN;
            case ROLE:
                return isSortalOrNonSortalSupertype(parent)
                        || parent == ClassStereotype.ROLE
                        || parent == ClassStereotype.ROLE_MIXIN;
            case PHASE_MIXIN:
                return parent == ClassStereotype.MIXIN
                        || parent == ClassStereotype.PHASE_MIXIN
                        || parent == ClassStereotype.CATEGORY;
            case ROLE_MIXIN:
                return parent == ClassStereotype.MIXIN
                        || parent == ClassStereotype.ROLE_MIXIN
                        || parent == ClassStereotype.CATEGORY
                        || parent == ClassStereotype.PHASE_MIXIN;
            default:
                throw new IllegalStateException("Unhandled stereotype: " + child);
        }
    }

    /** String form of {@link #isValidSubtyping(ClassStereotype, ClassStereotype)}. */
    public static boolean isValidSubtyping(String child, String parent) {
        Optional<ClassStereotype> c = ClassStereotype.fromLiteral(child);
        Optional<ClassStereotype> p = ClassStereotype.fromLiteral(parent);
        return c.isPresent() && p.isPresent() && isValidSubtyping(c.get(), p.get());
    }

    public static boolean isIdentityProvider(String literal) {
        return ClassStereotype.fromLiteral(literal).map(ClassStereotype::isIdentityProvider).orElse(false);
    }

    public static boolean requiresIdentity(String literal) {
        return ClassStereotype.fromLiteral(literal).map(ClassStereotype::requiresIdentity).orElse(false);
    }

    public static boolean isRigid(String literal) {
        return ClassStereotype.fromLiteral(literal).map(ClassStereotype::isRigid).orElse(false);
    }

    public static boolean isAntiRigid(String literal) {
        return ClassStereotype.fromLiteral(literal).map(ClassStereotype::isAntiRigid).orElse(false);
    }

    // kind, subkind, collective, quantity, relator, category, mixin, mode, quality
    private static boolean isSortalOrNonSortalSupertype(ClassStereotype parent) {
        switch (parent) {
            case KIND:
            case SUBKIND:
            case COLLECTIVE:
            case QUANTITY:
            case RELATOR:
            case CATEGORY:
            case MIXIN:
            case MODE:
            case QUALITY:
                return true;
            default:
                return false;
        }
    }
}
