package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/** Functional complex made of a single kind of component. */
public final class HomoFuncDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.HOMO_FUNC;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        for (ClassNode node : queries.index().classes()) {
            if (queries.index().outgoingOf(node.id, AssociationStereotype.COMPONENT_OF).size() == 1) {
                out.antiPattern(node.id, type());
            }
        }
    }
}
