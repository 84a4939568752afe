package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/**
 * Phase whose partitioned supertypes carry no intrinsic properties, so nothing in the model
 * says when an instance changes phase.
 */
public final class UndefPhaseDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.UNDEF_PHASE;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (ClassNode node : index.classes()) {
            if (!node.is(ClassStereotype.PHASE)) continue;
            if (!anyTargetDefinesPhases(queries, node)) {
                out.antiPattern(node.id, type());
            }
        }
    }

    private static boolean anyTargetDefinesPhases(HierarchyQueries queries, ClassNode phase) {
        for (OntoGeneralization g : phase.parentGeneralizations()) {
            for (String t : g.targetIds) {
                if (queries.index().isClass(t) && IntrinsicProperties.has(queries, t)) return true;
            }
        }
        return false;
    }
}
