package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.AssociationEdge;
import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.taxonomy.ClassStereotype;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/**
 * Binary relation whose two ends may be the same individual: a self-loop, ends related by
 * subtyping, or comparable ends that are not provably disjoint.
 */
public final class BinOverDetector implements AntiPatternDetector {

    @Override
    public AntiPatternType type() {
        return AntiPatternType.BIN_OVER;
    }

    @Override
    public void detect(HierarchyQueries queries, ProblemCollector out) {
        ModelIndex index = queries.index();
        for (AssociationEdge a : index.associations()) {
            ClassNode source = index.classNode(a.sourceId());
            ClassNode target = index.classNode(a.targetId());
            if (source == null || target == null) continue;

            if (a.isSelfLoop()
                    || queries.isSubtypeOf(source.id, target.id)
                    || queries.isSubtypeOf(target.id, source.id)
                    || mayOverlap(queries, source, target)) {
                out.antiPattern(a.id(), type());
            }
        }
    }

    private static boolean mayOverlap(HierarchyQueries queries, ClassNode a, ClassNode b) {
        ClassStereotype sa = a.stereotype;
        ClassStereotype sb = b.stereotype;
        if (sa == null || sb == null) return false;
        if (isSortalLike(sa) && isSortalLike(sb)) {
            return !queries.areDisjointUpwards(a.id, b.id);
        }
        if (sa.isNonSortal() && sb.isNonSortal()) {
            return !(queries.areDisjointUpwards(a.id, b.id) && queries.areDisjointDownwards(a.id, b.id));
        }
        return false;
    }

    private static boolean isSortalLike(ClassStereotype st) {
        return st.isSortal() || st.isAspect();
    }
}
