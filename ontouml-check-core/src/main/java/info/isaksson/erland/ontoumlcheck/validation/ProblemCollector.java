package info.isaksson.erland.ontoumlcheck.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects problems during one validation run.
 *
 * <p>Problems keep the order in which they were reported. An anti-pattern is recorded at most
 * once per (type, element).</p>
 */
public final class ProblemCollector {

    private final List<ValidationProblem> problems = new ArrayList<>();
    private final Set<AntiPatternOccurrence> seenAntiPatterns = new HashSet<>();

    public void error(String elementId, ErrorKind kind, String message) {
        problems.add(new StructuralError(elementId, kind, null, message));
    }

    public void relationError(String elementId, RelationIssue issue, String message) {
        problems.add(new StructuralError(elementId, ErrorKind.INVALID_RELATION, issue, message));
    }

    public void antiPattern(String elementId, AntiPatternType type) {
        AntiPatternOccurrence occurrence = new AntiPatternOccurrence(elementId, type);
        if (seenAntiPatterns.add(occurrence)) {
            problems.add(occurrence);
        }
    }

    public int size() {
        return problems.size();
    }

    public List<ValidationProblem> toList() {
        return Collections.unmodifiableList(new ArrayList<>(problems));
    }
}
