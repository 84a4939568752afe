package info.isaksson.erland.ontoumlcheck.core;

import info.isaksson.erland.ontoumlcheck.validation.AntiPatternOccurrence;
import info.isaksson.erland.ontoumlcheck.validation.StructuralError;
import info.isaksson.erland.ontoumlcheck.validation.ValidationProblem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Problems found by one run, errors first, each phase in element traversal order. */
public final class ValidationResult {
    public final List<ValidationProblem> problems;

    /** Options the run used. */
    public final ValidationOptions options;

    ValidationResult(List<ValidationProblem> problems, ValidationOptions options) {
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
        this.options = options;
    }

    public boolean isEmpty() {
        return problems.isEmpty();
    }

    public List<StructuralError> errors() {
        List<StructuralError> out = new ArrayList<>();
        for (ValidationProblem p : problems) {
            if (p instanceof StructuralError) out.add((StructuralError) p);
        }
        return out;
    }

    public List<AntiPatternOccurrence> antiPatterns() {
        List<AntiPatternOccurrence> out = new ArrayList<>();
        for (ValidationProblem p : problems) {
            if (p instanceof AntiPatternOccurrence) out.add((AntiPatternOccurrence) p);
        }
        return out;
    }

    /** Number of problems per code, in order of first appearance. */
    public Map<String, Integer> countsByCode() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ValidationProblem p : problems) {
            counts.merge(p.code(), 1, Integer::sum);
        }
        return counts;
    }
}
