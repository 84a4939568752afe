package info.isaksson.erland.ontoumlcheck.taxonomy;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ClassStereotypeTest {

    @Test
    void literalLookupTrimsButIsCaseSensitive() {
        assertEquals(Optional.of(ClassStereotype.ROLE_MIXIN), ClassStereotype.fromLiteral(" roleMixin "));
        assertEquals(Optional.empty(), ClassStereotype.fromLiteral("Kind"));
        assertEquals(Optional.empty(), ClassStereotype.fromLiteral(""));
        assertEquals(Optional.empty(), ClassStereotype.fromLiteral(null));
        assertEquals(Optional.empty(), ClassStereotype.fromLiteral("event"));
    }

    @Test
    void everyLiteralRoundTrips() {
        for (ClassStereotype st : ClassStereotype.values()) {
            assertEquals(Optional.of(st), ClassStereotype.fromLiteral(st.literal()));
        }
    }

    @Test
    void identityProvidersAndRigidity() {
        EnumSet<ClassStereotype> providers = EnumSet.noneOf(ClassStereotype.class);
        EnumSet<ClassStereotype> rigid = EnumSet.noneOf(ClassStereotype.class);
        EnumSet<ClassStereotype> antiRigid = EnumSet.noneOf(ClassStereotype.class);
        for (ClassStereotype st : ClassStereotype.values()) {
            if (st.isIdentityProvider()) providers.add(st);
            if (st.isRigid()) rigid.add(st);
            if (st.isAntiRigid()) antiRigid.add(st);
        }

        assertEquals(EnumSet.of(ClassStereotype.KIND, ClassStereotype.COLLECTIVE, ClassStereotype.QUANTITY,
                ClassStereotype.RELATOR, ClassStereotype.QUALITY, ClassStereotype.MODE), providers);
        assertEquals(EnumSet.of(ClassStereotype.KIND, ClassStereotype.SUBKIND, ClassStereotype.COLLECTIVE,
                ClassStereotype.QUANTITY, ClassStereotype.RELATOR, ClassStereotype.CATEGORY,
                ClassStereotype.MODE, ClassStereotype.QUALITY), rigid);
        assertEquals(EnumSet.of(ClassStereotype.ROLE, ClassStereotype.PHASE,
                ClassStereotype.PHASE_MIXIN, ClassStereotype.ROLE_MIXIN), antiRigid);
    }

    @Test
    void mixinIsNeitherRigidNorAntiRigid() {
        assertFalse(ClassStereotype.MIXIN.isRigid());
        assertFalse(ClassStereotype.MIXIN.isAntiRigid());
    }

    @Test
    void nonSortalsDoNotRequireIdentity() {
        for (ClassStereotype st : ClassStereotype.values()) {
            assertEquals(!st.isNonSortal(), st.requiresIdentity(), st.literal());
        }
        assertTrue(ClassStereotype.QUALITY.isAspect());
        assertFalse(ClassStereotype.QUALITY.isSortal());
    }
}
