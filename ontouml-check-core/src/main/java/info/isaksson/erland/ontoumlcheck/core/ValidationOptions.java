package info.isaksson.erland.ontoumlcheck.core;

import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;

import java.util.EnumSet;

/**
 * Options for one validation run.
 *
 * <p>Mirrors the CLI flags in a structured form. The defaults match the "Validate" tab:
 * structural errors on, anti-patterns off.</p>
 */
public final class ValidationOptions {
    public boolean checkErrors = true;

    public boolean checkAntipatterns = false;

    /**
     * Detectors to run when {@link #checkAntipatterns} is set. Defaults to all of them;
     * a null or empty set runs none.
     */
    public EnumSet<AntiPatternType> enabledAntiPatterns = EnumSet.allOf(AntiPatternType.class);

    /** Both phases, every detector. */
    public static ValidationOptions all() {
        ValidationOptions o = new ValidationOptions();
        o.checkAntipatterns = true;
        return o;
    }

    @Override
    public String toString() {
        return "errors=" + checkErrors + ", antipatterns=" + checkAntipatterns
                + (checkAntipatterns ? ", detectors=" + enabledAntiPatterns : "");
    }
}
