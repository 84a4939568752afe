package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.AssociationEdge;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.taxonomy.AssociationStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/** Formal association between ends that have no properties to compare. */
public final class UndefFormalDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.UNDEF_FORMAL;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (AssociationEdge a : index.associations()) {
            if (!a.is(AssociationStereotype.FORMAL)) continue;
            if (!index.isClass(a.sourceId()) || !index.isClass(a.targetId())) continue;
            if (!IntrinsicProperties.has(queries, a.sourceId()) || !IntrinsicProperties.has(queries, a.targetId())) {
                out.antiPattern(a.id(), type());
            }
        }
    }
}
