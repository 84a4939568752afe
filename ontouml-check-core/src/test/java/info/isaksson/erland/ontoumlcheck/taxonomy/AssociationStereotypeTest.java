package info.isaksson.erland.ontoumlcheck.taxonomy;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class AssociationStereotypeTest {

    @Test
    void blankMeansPlainAssociation() {
        assertEquals(Optional.of(AssociationStereotype.NONE), AssociationStereotype.fromLiteral(""));
        assertEquals(Optional.of(AssociationStereotype.NONE), AssociationStereotype.fromLiteral(null));
        assertEquals(Optional.of(AssociationStereotype.NONE), AssociationStereotype.fromLiteral("  "));
    }

    @Test
    void lookupByLiteral() {
        assertEquals(Optional.of(AssociationStereotype.MEMBER_OF), AssociationStereotype.fromLiteral("memberOf"));
        assertEquals(Optional.empty(), AssociationStereotype.fromLiteral("memberof"));
        assertTrue(AssociationStereotype.COMPONENT_OF.isPartWhole());
        assertFalse(AssociationStereotype.MEDIATION.isPartWhole());
    }
}
