package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.graph.HierarchyQueries;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;

/**
 * One anti-pattern check. Detectors only read the model and report through the collector;
 * they do not share state, so any subset can run in any order.
 */
public interface AntiPatternDetector {

    AntiPatternType type();

    void detect(HierarchyQueries queries, ProblemCollector out);
}
