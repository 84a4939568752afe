package info.isaksson.erland.ontoumlcheck.multiplicity;

import java.util.Objects;

/**
 * A parsed multiplicity range {@code lower..upper}.
 */
public final class Multiplicity {

    /** Upper bound value representing '*' (unbounded). */
    public static final int STAR = -1;

    public static final Multiplicity ANY = new Multiplicity(0, STAR);

    public final int lower;
    public final int upper; // STAR for '*'

    public Multiplicity(int lower, int upper) {
        this.lower = Math.max(0, lower);
        this.upper = upper < 0 ? STAR : upper;
    }

    public boolean isUnbounded() {
        return upper == STAR;
    }

    /** False for ranges such as {@code 3..1}. */
    public boolean isConsistent() {
        return isUnbounded() || upper >= lower;
    }

    public boolean isExactlyOne() {
        return lower == 1 && upper == 1;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Multiplicity)) return false;
        Multiplicity that = (Multiplicity) o;
        return lower == that.lower && upper == that.upper;
    }

    @Override public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override public String toString() {
        return lower + ".." + (isUnbounded() ? "*" : String.valueOf(upper));
    }
}
