package info.isaksson.erland.ontoumlcheck.sink;

import info.isaksson.erland.ontoumlcheck.core.ValidationResult;
import info.isaksson.erland.ontoumlcheck.validation.ValidationProblem;

/** Feeds a {@link ValidationResult} to a {@link DiagnosticSink}, one row per problem. */
public final class DiagnosticPublisher {

    private DiagnosticPublisher() {}

    public static void publish(ValidationResult result, DiagnosticSink sink) {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        sink.clearHighlighting();
        sink.clearResults();
        for (ValidationProblem p : result.problems) {
            sink.highlight(p.elementId, p.isError() ? HighlightKind.INVALID : HighlightKind.WARNING);
            sink.addRow(toRow(p));
        }
    }

    public static ResultRow toRow(ValidationProblem p) {
        String label = p.isError() ? ResultRow.ERROR_LABEL : ResultRow.ANTI_PATTERN_LABEL;
        return new ResultRow(label, p.text(), p.elementId);
    }
}
