package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/** Generalization set whose sources mix rigid and anti-rigid types. */
public final class GSRigDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.GS_RIG;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        for (OntoGeneralization g : queries.index().generalizations()) {
            boolean rigid = false;
            boolean antiRigid = false;
            for (String s : g.sourceIds) {
                ClassNode source = queries.index().classNode(s);
                if (source == null) continue;
                rigid |= source.isRigid();
                antiRigid |= source.isAntiRigid();
            }
            if (rigid && antiRigid) {
                out.antiPattern(g.id, type());
            }
        }
    }
}
