package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/** Collective whose members are of more than one type. */
public final class HetCollDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.HET_COLL;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        for (ClassNode node : queries.index().classes()) {
            if (!node.is(ClassStereotype.COLLECTIVE)) continue;
            if (queries.index().outgoingOf(node.id, AssociationStereotype.MEMBER_OF).size() > 1) {
                out.antiPattern(node.id, type());
            }
        }
    }
}
