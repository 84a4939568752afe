package info.isaksson.erland.ontoumlcheck.multiplicity;

import java.util.Optional;

/**
 * Parses multiplicity labels.
 *
 * <pre>
 *   ""      -> empty
 *   "*"     -> 0..*
 *   "n"     -> n..n
 *   "l..u"  -> l..u
 *   "l..*"  -> l..*
 * </pre>
 *
 * Anything else is empty as well. A range whose upper bound is below the lower bound still
 * parses; callers check {@link Multiplicity#isConsistent()}.
 */
public final class MultiplicityParser {

    private MultiplicityParser() {}

    public static Optional<Multiplicity> parse(String text) {
        if (text == null) return Optional.empty();
        String s = text.trim();
        if (s.isEmpty()) return Optional.empty();

        if (s.equals("*")) {
            return Optional.of(Multiplicity.ANY);
        }

        int dots = s.indexOf("..");
        if (dots < 0) {
            Integer n = parseBound(s);
            return n == null ? Optional.empty() : Optional.of(new Multiplicity(n, n));
        }

        Integer lower = parseBound(s.substring(0, dots).trim());
        if (lower == null) return Optional.empty();

        String upperText = s.substring(dots + 2).trim();
        if (upperText.equals("*")) {
            return Optional.of(new Multiplicity(lower, Multiplicity.STAR));
        }
        Integer upper = parseBound(upperText);
        if (upper == null) return Optional.empty();
        return Optional.of(new Multiplicity(lower, upper));
    }

    /** Non-negative decimal integer, or null. */
    private static Integer parseBound(String s) {
        if (s.isEmpty()) return null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return null;
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException ex) {
            // More digits than an int holds.
            return null;
        }
    }
}
