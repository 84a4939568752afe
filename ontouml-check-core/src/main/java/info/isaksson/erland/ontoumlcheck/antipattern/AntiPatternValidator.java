package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Runs the enabled anti-pattern detectors one after another.
 */
public final class AntiPatternValidator {

    private static final Logger log = LoggerFactory.getLogger(AntiPatternValidator.class);

    private final List<AntiPatternDetector> detectors;

    public AntiPatternValidator() {
        this(defaultDetectors());
    }

    public AntiPatternValidator(List<AntiPatternDetector> detectors) {
        if (detectors == null) throw new IllegalArgumentException("detectors must not be null");
        this.detectors = List.copyOf(detectors);
    }

    /** One detector per {@link AntiPatternType}, in declaration order. */
    public static List<AntiPatternDetector> defaultDetectors() {
        return List.of(
                new BinOverDetector(),
                new DecIntDetector(),
                new DepPhaseDetector(),
                new FreeRoleDetector(),
                new GSRigDetector(),
                new HetCollDetector(),
                new HomoFuncDetector(),
                new MixRigDetector(),
                new MultDepDetector(),
                new RelRigDetector(),
                new UndefFormalDetector(),
                new UndefPhaseDetector()
        );
    }

    /** Runs the detectors whose type is in {@code enabled}; a null or empty set runs none. */
    public void validate(ModelIndex index, Set<AntiPatternType> enabled, ProblemCollector out) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        if (out == null) throw new IllegalArgumentException("out must not be null");
        if (enabled == null || enabled.isEmpty()) return;
        HierarchyQueries queries = new HierarchyQueries(index);
        for (AntiPatternDetector d : detectors) {
            if (!enabled.contains(d.type())) continue;
            int before = out.size();
            d.detect(queries, out);
            log.debug("{}: {} occurrence(s)", d.type().code(), out.size() - before);
        }
    }
}
