package info.isaksson.erland.ontoumlcheck.graph;

import info.isaksson.erland.ontoumlcheck.model.OntoAssociation;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;

/**
 * An association together with its classified stereotype.
 */
public final class AssociationEdge {
    public final OntoAssociation element;

    /** Null when the literal is not a known association stereotype. */
    public final AssociationStereotype stereotype;

    AssociationEdge(OntoAssociation element) {
        this.element = element;
        this.stereotype = AssociationStereotype.fromLiteral(element.stereotype).orElse(null);
    }

    public String id() {
        return element.id;
    }

    public String sourceId() {
        return element.sourceId;
    }

    public String targetId() {
        return element.targetId;
    }

    public boolean is(AssociationStereotype st) {
        return stereotype == st;
    }

    public boolean isSelfLoop() {
        return element.sourceId.equals(element.targetId);
    }

    /** The end opposite to {@code classId}; for a self-loop that is the same id. */
    public String otherEnd(String classId) {
        return element.sourceId.equals(classId) ? element.targetId : element.sourceId;
    }
}
