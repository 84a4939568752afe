package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/**
 * Class specialized along more than one classification axis, i.e. an intersection type that
 * may not mean what the modeler expects.
 */
public final class DecIntDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.DEC_INT;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (ClassNode node : index.classes()) {
            int axes = 0;
            for (OntoGeneralization g : node.parentGeneralizations()) {
                axes += g.isDisjoint ? 1 : concreteTargets(index, g);
            }
            if (axes > 1) {
                out.antiPattern(node.id, type());
            }
        }
    }

    private static int concreteTargets(ModelIndex index, OntoGeneralization g) {
        int n = 0;
        for (String t : g.targetIds) {
            ClassNode target = index.classNode(t);
            if (target != null && !target.isAbstract()) n++;
        }
        return n;
    }
}
