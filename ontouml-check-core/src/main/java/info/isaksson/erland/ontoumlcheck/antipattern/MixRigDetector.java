package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/**
 * Mixin whose direct subtypes are all rigid or all anti-rigid; a mixin is meant to
 * generalize both.
 */
public final class MixRigDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.MIX_RIG;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (ClassNode node : index.classes()) {
            if (!node.is(ClassStereotype.MIXIN)) continue;
            boolean rigidChildren = false;
            boolean antiRigidChildren = false;
            for (String childId : index.childIds(node.id)) {
                ClassNode child = index.classNode(childId);
                rigidChildren |= child.isRigid();
                antiRigidChildren |= child.isAntiRigid();
            }
            if (rigidChildren != antiRigidChildren) {
                out.antiPattern(node.id, type());
            }
        }
    }
}
