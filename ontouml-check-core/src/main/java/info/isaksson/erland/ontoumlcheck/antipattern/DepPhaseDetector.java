package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/** Phase that takes part in a mediation, which suggests it is really a role. */
public final class DepPhaseDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.DEP_PHASE;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        for (ClassNode node : queries.index().classes()) {
            if (!node.is(ClassStereotype.PHASE)) continue;
            if (!queries.index().associationsOf(node.id, AssociationStereotype.MEDIATION).isEmpty()) {
                out.antiPattern(node.id, type());
            }
        }
    }
}
