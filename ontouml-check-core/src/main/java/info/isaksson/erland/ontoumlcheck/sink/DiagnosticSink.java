package info.isaksson.erland.ontoumlcheck.sink;

/**
 * Host side of a validation run: the canvas highlights and the results table.
 */
public interface DiagnosticSink {

    /** Remove highlights left by a previous run. */
    void clearHighlighting();

    /** Empty the results table of a previous run. */
    void clearResults();

    void highlight(String elementId, HighlightKind kind);

    void addRow(ResultRow row);
}
