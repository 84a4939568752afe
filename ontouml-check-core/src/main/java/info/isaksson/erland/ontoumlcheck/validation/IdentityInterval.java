package info.isaksson.erland.ontoumlcheck.validation;

/** Accumulated (min, max) number of identity providers a class can inherit. */
final class IdentityInterval {
    int min;
    int max;

    IdentityInterval(int min, int max) {
        this.min = min;
        this.max = max;
    }

    void add(int min, int max) {
        this.min += min;
        this.max += max;
    }

    boolean isExactlyOne() {
        return min == 1 && max == 1;
    }

    /**
     * Weight a generalization contributes to each of its sources.
     *
     * @param targets    number of class targets
     * @param providers  targets whose stereotype provides or requires identity
     */
    static IdentityInterval weightOf(int targets, int providers, boolean disjoint, boolean covering) {
        if (disjoint || targets == 1) {
            int min = providers == targets && providers > 0 ? 1 : 0;
            return new IdentityInterval(min, Math.min(providers, 1));
        }
        if (covering) {
            return new IdentityInterval(Math.min(providers, 1), providers);
        }
        return new IdentityInterval(0, providers + 1);
    }

    @Override public String toString() {
        return min == max ? String.valueOf(min) : min + ".." + max;
    }
}
