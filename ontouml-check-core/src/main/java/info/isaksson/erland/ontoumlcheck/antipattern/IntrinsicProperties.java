package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;

/**
 * A class has intrinsic properties when it, or one of its supertypes, declares attributes
 * or is characterized by a quality or mode.
 */
final class IntrinsicProperties {

    private IntrinsicProperties() {}

    static boolean has(HierarchyQueries queries, String classId) {
        ModelIndex index = queries.index();
        return queries.anySelfOrAncestor(classId, n ->
                !n.element.properties.isBlank()
                        || !index.outgoingOf(n.id, AssociationStereotype.CHARACTERIZATION).isEmpty());
    }
}
