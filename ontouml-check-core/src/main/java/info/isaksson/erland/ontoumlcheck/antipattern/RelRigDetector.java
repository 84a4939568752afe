package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.AssociationEdge;
import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/** Relator that mediates a rigid type instead of the role played in the relation. */
public final class RelRigDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.REL_RIG;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (ClassNode node : index.classes()) {
            if (!queries.anySelfOrAncestor(node.id, n -> n.is(ClassStereotype.RELATOR))) continue;
            for (AssociationEdge a : index.associationsOf(node.id, AssociationStereotype.MEDIATION)) {
                ClassNode other = index.classNode(a.otherEnd(node.id));
                if (other != null && other.isRigid()) {
                    out.antiPattern(node.id, type());
                    break;
                }
            }
        }
    }
}
