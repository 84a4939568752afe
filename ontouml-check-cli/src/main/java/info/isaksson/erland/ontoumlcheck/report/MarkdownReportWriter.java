package info.isaksson.erland.ontoumlcheck.report;

import info.isaksson.erland.ontoumlcheck.core.ValidationResult;
import info.isaksson.erland.ontoumlcheck.sink.DiagnosticPublisher;
import info.isaksson.erland.ontoumlcheck.sink.ResultRow;
import info.isaksson.erland.ontoumlcheck.validation.ValidationProblem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report of one validation run.
 */
public final class MarkdownReportWriter {

    private MarkdownReportWriter() {}

    public static void write(Path reportPath, String modelName, Path modelPath, ValidationResult result) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, render(modelName, modelPath, result));
    }

    public static String render(String modelName, Path modelPath, ValidationResult result) {
        StringBuilder report = new StringBuilder();
        report.append("# ontouml-check report\n\n");

        report.append("## Summary\n\n");
        report.append("- Model: `").append(modelName).append("`\n");
        if (modelPath != null) {
            report.append("- Snapshot: `").append(modelPath).append("`\n");
        }
        report.append("- Check errors: **").append(result.options.checkErrors).append("**\n");
        report.append("- Check anti-patterns: **").append(result.options.checkAntipatterns).append("**\n");
        if (result.options.checkAntipatterns) {
            report.append("- Detectors: ").append(result.options.enabledAntiPatterns == null || result.options.enabledAntiPatterns.isEmpty()
                    ? "_(none)_"
                    : "`" + String.join("`, `", detectorCodes(result)) + "`").append("\n");
        }
        report.append("- Errors: **").append(result.errors().size()).append("**\n");
        report.append("- Anti-patterns: **").append(result.antiPatterns().size()).append("**\n\n");

        if (result.isEmpty()) {
            report.append(ResultRow.NO_PROBLEMS_TEXT).append(".\n");
            return report.toString();
        }

        report.append("## Problems by kind\n\n");
        report.append("| Kind | Count |\n");
        report.append("|---|---:|\n");
        for (Map.Entry<String, Integer> e : result.countsByCode().entrySet()) {
            report.append("| ").append(e.getKey()).append(" | ").append(e.getValue()).append(" |\n");
        }

        report.append("\n## Problems\n\n");
        report.append("| Severity | Kind | Element | Message |\n");
        report.append("|---|---|---|---|\n");
        for (ValidationProblem p : result.problems) {
            ResultRow row = DiagnosticPublisher.toRow(p);
            report.append("| ").append(row.label)
                    .append(" | ").append(p.code())
                    .append(" | `").append(row.elementId).append('`')
                    .append(" | ").append(escape(row.text))
                    .append(" |\n");
        }
        return report.toString();
    }

    private static List<String> detectorCodes(ValidationResult result) {
        List<String> codes = new ArrayList<>();
        result.options.enabledAntiPatterns.forEach(t -> codes.add(t.code()));
        return codes;
    }

    private static String escape(String s) {
        return s.replace("|", "\\|").replace("\n", " ");
    }
}
