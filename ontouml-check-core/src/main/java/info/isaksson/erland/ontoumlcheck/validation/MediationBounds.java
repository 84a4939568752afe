package info.isaksson.erland.ontoumlcheck.validation;

import info.isaksson.erland.ontoumlcheck.graph.ClassNode;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Sums of "opposing" mediation lower bounds per class, own and inherited.
 *
 * <p>For a mediation {@code R -> X} the relator side {@code R} accumulates the lower bound
 * written at {@code X}'s end and {@code X} accumulates the one at {@code R}'s end.</p>
 */
final class MediationBounds {

    private final ModelIndex index;
    private final Map<String, Integer> own = new HashMap<>();
    private final Map<String, Integer> totals = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    MediationBounds(ModelIndex index) {
        this.index = index;
    }

    void accumulate(String classId, int opposingLower) {
        own.merge(classId, opposingLower, (x, y) -> saturate((long) x + y));
        totals.clear();
    }

    int own(String classId) {
        return own.getOrDefault(classId, 0);
    }

    /**
     * Own bounds plus those inherited from supertypes. A disjoint generalization contributes
     * the smallest total among its targets, any other contributes the sum over its targets.
     * Totals saturate at {@link Integer#MAX_VALUE}.
     *
     * <p>Totals are memoized per class until the next {@link #accumulate(String, int)}. On a
     * generalization cycle a class reached again while its own total is open contributes 0.</p>
     */
    int total(String classId) {
        Integer known = totals.get(classId);
        if (known != null) return known;
        if (!inProgress.add(classId)) return 0;
        try {
            long sum = own(classId);
            ClassNode node = index.classNode(classId);
            if (node != null) {
                for (OntoGeneralization g : node.parentGeneralizations()) {
                    sum += contribution(g);
                }
            }
            int result = saturate(sum);
            totals.put(classId, result);
            return result;
        } finally {
            inProgress.remove(classId);
        }
    }

    private long contribution(OntoGeneralization g) {
        long contribution = 0;
        boolean first = true;
        for (String t : g.targetIds) {
            if (!index.isClass(t)) continue;
            int v = total(t);
            if (g.isDisjoint) {
                contribution = first ? v : Math.min(contribution, v);
            } else {
                contribution += v;
            }
            first = false;
        }
        return contribution;
    }

    private static int saturate(long value) {
        return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }
}
