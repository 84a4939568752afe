package info.isaksson.erland.ontoumlcheck;

import info.isaksson.erland.ontoumlcheck.sink.DiagnosticSink;
import info.isaksson.erland.ontoumlcheck.sink.HighlightKind;
import info.isaksson.erland.ontoumlcheck.sink.ResultRow;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results table for the terminal. Highlights have nowhere to go, so they are kept as a
 * marker column next to each element id.
 */
final class ConsoleSink implements DiagnosticSink {

    private final List<ResultRow> rows = new ArrayList<>();
    private final Map<String, HighlightKind> highlights = new LinkedHashMap<>();

    @Override
    public void clearHighlighting() {
        highlights.clear();
    }

    @Override
    public void clearResults() {
        rows.clear();
    }

    @Override
    public void highlight(String elementId, HighlightKind kind) {
        // An element with both an error and an anti-pattern stays marked invalid.
        highlights.merge(elementId, kind, (a, b) -> a == HighlightKind.INVALID ? a : b);
    }

    @Override
    public void addRow(ResultRow row) {
        rows.add(row);
    }

    List<ResultRow> rows() {
        return rows;
    }

    HighlightKind highlightOf(String elementId) {
        return highlights.get(elementId);
    }

    void render(PrintStream out) {
        if (rows.isEmpty()) {
            out.println(ResultRow.NO_PROBLEMS_TEXT);
            return;
        }
        out.println("Results:");
        int labelWidth = ResultRow.ANTI_PATTERN_LABEL.length();
        for (ResultRow r : rows) {
            out.println(pad(r.label, labelWidth) + "  " + r.text + "  [" + r.elementId + "]");
        }
    }

    private static String pad(String s, int width) {
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) sb.append(' ');
        return sb.toString();
    }
}
