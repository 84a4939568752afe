package info.isaksson.erland.ontoumlcheck.graph;

import info.isaksson.erland.ontoumlcheck.model.OntoClass;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-class entry of a {@link ModelIndex}: the class plus the edges touching it.
 */
public final class ClassNode {
    public final String id;
    public final OntoClass element;

    /** Null when the literal is not a known stereotype. */
    public final ClassStereotype stereotype;

    private final List<OntoGeneralization> parentGeneralizations = new ArrayList<>();
    private final List<OntoGeneralization> childGeneralizations = new ArrayList<>();
    private final List<AssociationEdge> outgoing = new ArrayList<>();
    private final List<AssociationEdge> incoming = new ArrayList<>();

    ClassNode(OntoClass element) {
        this.id = element.id;
        this.element = element;
        this.stereotype = ClassStereotype.fromLiteral(element.stereotype).orElse(null);
    }

    public boolean is(ClassStereotype st) {
        return stereotype == st;
    }

    public boolean hasKnownStereotype() {
        return stereotype != null;
    }

    public boolean isRigid() {
        return stereotype != null && stereotype.isRigid();
    }

    public boolean isAntiRigid() {
        return stereotype != null && stereotype.isAntiRigid();
    }

    public boolean isAbstract() {
        return element.isAbstract;
    }

    /** Generalizations in which this class is a source (edges towards its supertypes). */
    public List<OntoGeneralization> parentGeneralizations() {
        return Collections.unmodifiableList(parentGeneralizations);
    }

    /** Generalizations in which this class is a target (edges from its subtypes). */
    public List<OntoGeneralization> childGeneralizations() {
        return Collections.unmodifiableList(childGeneralizations);
    }

    public List<AssociationEdge> outgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public List<AssociationEdge> incoming() {
        return Collections.unmodifiableList(incoming);
    }

    void addParentGeneralization(OntoGeneralization g) {
        if (!containsSame(parentGeneralizations, g)) parentGeneralizations.add(g);
    }

    void addChildGeneralization(OntoGeneralization g) {
        if (!containsSame(childGeneralizations, g)) childGeneralizations.add(g);
    }

    // A class listed twice in one generalization still has a single edge to it.
    private static boolean containsSame(List<OntoGeneralization> list, OntoGeneralization g) {
        for (OntoGeneralization x : list) {
            if (x == g) return true;
        }
        return false;
    }

    void addOutgoing(AssociationEdge a) {
        outgoing.add(a);
    }

    void addIncoming(AssociationEdge a) {
        incoming.add(a);
    }

    @Override public String toString() {
        return element.toString() + " [" + id + "]";
    }
}
