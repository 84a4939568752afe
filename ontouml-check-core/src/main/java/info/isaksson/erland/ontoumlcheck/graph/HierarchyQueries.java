package info.isaksson.erland.ontoumlcheck.graph;

import info.isaksson.erland.ontoumlcheck.model.OntoGeneralization;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Closure queries over the generalization graph of a {@link ModelIndex}.
 *
 * <p>Closures are computed breadth-first with a visited set per walk, so each class is expanded
 * at most once per walk and the queries terminate on cyclic input. Results are cached per
 * instance; the index is a read snapshot, so one instance serves a whole validation run.
 * Not thread-safe.</p>
 */
public final class HierarchyQueries {

    private final ModelIndex index;

    private final Map<String, Set<String>> strictAncestors = new HashMap<>();
    private final Map<String, List<String>> upward = new HashMap<>();
    private final Map<String, List<String>> downward = new HashMap<>();

    public HierarchyQueries(ModelIndex index) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        this.index = index;
    }

    public ModelIndex index() {
        return index;
    }

    /**
     * Whether {@code a} reaches {@code b} through one or more generalization edges.
     * A class is not its own subtype unless a cycle (or a self-edge) leads back to it.
     */
    public boolean isSubtypeOf(String a, String b) {
        if (a == null || b == null) return false;
        return ancestorsOf(a).contains(b);
    }

    /** {@code a == b} or {@link #isSubtypeOf(String, String)}. */
    public boolean isSelfOrSubtypeOf(String a, String b) {
        return a != null && (a.equals(b) || isSubtypeOf(a, b));
    }

    /** {@code a} and all its ancestors, nearest first. */
    public List<String> upperBounds(String a) {
        if (a == null || !index.isClass(a)) return List.of();
        return upward.computeIfAbsent(a, k -> byDistance(k, true));
    }

    /** {@code b} and all its descendants, nearest first. */
    public List<String> lowerBounds(String b) {
        if (b == null || !index.isClass(b)) return List.of();
        return downward.computeIfAbsent(b, k -> byDistance(k, false));
    }

    /** Ids that are {@code a}-or-ancestor and {@code b}-or-ancestor, nearest to {@code a} first. */
    public List<String> commonUpperBounds(String a, String b) {
        List<String> fromA = upperBounds(a);
        Set<String> fromB = new HashSet<>(upperBounds(b));
        List<String> out = new ArrayList<>();
        for (String x : fromA) {
            if (fromB.contains(x)) out.add(x);
        }
        return out;
    }

    /** Ids that are {@code b}-or-descendant and {@code a}-or-descendant, nearest to {@code b} first. */
    public List<String> commonLowerBounds(String a, String b) {
        List<String> fromB = lowerBounds(b);
        Set<String> fromA = new HashSet<>(lowerBounds(a));
        List<String> out = new ArrayList<>();
        for (String x : fromB) {
            if (fromA.contains(x)) out.add(x);
        }
        return out;
    }

    /** First of {@code a}'s upper bounds that is also an upper bound of {@code b}. */
    public Optional<String> leastUpperBound(String a, String b) {
        List<String> common = commonUpperBounds(a, b);
        return common.isEmpty() ? Optional.empty() : Optional.of(common.get(0));
    }

    /** First of {@code b}'s lower bounds that is also a lower bound of {@code a}. */
    public Optional<String> greatestLowerBound(String a, String b) {
        List<String> common = commonLowerBounds(a, b);
        return common.isEmpty() ? Optional.empty() : Optional.of(common.get(0));
    }

    /**
     * Whether no instance can belong to both {@code a} and {@code b}, judged on their supertypes:
     * either they share no supertype, or a disjoint generalization set at a common supertype
     * puts them in different branches.
     */
    public boolean areDisjointUpwards(String a, String b) {
        if (related(a, b)) return false;
        List<String> common = commonUpperBounds(a, b);
        if (common.isEmpty()) return true;
        return separatedAt(common, a, b);
    }

    /**
     * Like {@link #areDisjointUpwards(String, String)} but judged on subtypes: true when they
     * share no subtype, or when a shared subtype could never be instantiated because a disjoint
     * set separates their lineages.
     */
    public boolean areDisjointDownwards(String a, String b) {
        if (related(a, b)) return false;
        if (commonLowerBounds(a, b).isEmpty()) return true;
        return separatedAt(commonUpperBounds(a, b), a, b);
    }

    /** Whether {@code classId} or one of its ancestors satisfies {@code predicate}. */
    public boolean anySelfOrAncestor(String classId, Predicate<ClassNode> predicate) {
        ClassNode node = index.classNode(classId);
        if (node == null) return false;
        if (predicate.test(node)) return true;
        for (String ancestor : ancestorsOf(classId)) {
            if (ancestor.equals(classId)) continue;
            if (predicate.test(index.classNode(ancestor))) return true;
        }
        return false;
    }

    /** Ids reachable through one or more generalization edges; contains {@code classId} only on a cycle. */
    private Set<String> ancestorsOf(String classId) {
        Set<String> cached = strictAncestors.get(classId);
        if (cached != null) return cached;
        Set<String> out = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(index.parentIds(classId));
        while (!queue.isEmpty()) {
            String next = queue.removeFirst();
            if (out.add(next)) queue.addAll(index.parentIds(next));
        }
        Set<String> result = Collections.unmodifiableSet(out);
        strictAncestors.put(classId, result);
        return result;
    }

    private boolean related(String a, String b) {
        return a == null || b == null || a.equals(b) || isSubtypeOf(a, b) || isSubtypeOf(b, a);
    }

    private boolean separatedAt(List<String> bounds, String a, String b) {
        for (String bound : bounds) {
            ClassNode node = index.classNode(bound);
            if (node == null) continue;
            for (OntoGeneralization g : node.childGeneralizations()) {
                if (!g.isDisjoint) continue;
                if (inDifferentBranches(g, a, b)) return true;
            }
        }
        return false;
    }

    private boolean inDifferentBranches(OntoGeneralization g, String a, String b) {
        for (String s1 : g.sourceIds) {
            if (!isSelfOrSubtypeOf(a, s1)) continue;
            for (String s2 : g.sourceIds) {
                if (!s1.equals(s2) && isSelfOrSubtypeOf(b, s2)) return true;
            }
        }
        return false;
    }

    // Breadth-first order is nearest first; ties keep declaration order.
    private List<String> byDistance(String start, boolean upwards) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            String node = queue.removeFirst();
            List<String> next = upwards ? index.parentIds(node) : index.childIds(node);
            for (String n : next) {
                if (seen.add(n)) queue.addLast(n);
            }
        }
        return List.copyOf(seen);
    }
}
