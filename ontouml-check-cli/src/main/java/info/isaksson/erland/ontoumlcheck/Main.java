package info.isaksson.erland.ontoumlcheck;

import info.isaksson.erland.ontoumlcheck.core.OntoUmlValidationService;
import info.isaksson.erland.ontoumlcheck.core.ValidationOptions;
import info.isaksson.erland.ontoumlcheck.core.ValidationResult;
import info.isaksson.erland.ontoumlcheck.model.ModelJson;
import info.isaksson.erland.ontoumlcheck.model.OntoModel;
import info.isaksson.erland.ontoumlcheck.report.MarkdownReportWriter;
import info.isaksson.erland.ontoumlcheck.sink.DiagnosticPublisher;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;

/**
 * Command-line host for the validator: reads a JSON model snapshot, validates it and prints
 * the results table.
 */
public final class Main {

    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.verbose) {
            // Must happen before the first logger is created.
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }

        if (parsed.model == null) {
            System.err.println("Error: --model is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path modelPath = Paths.get(parsed.model).toAbsolutePath().normalize();
        if (!Files.exists(modelPath) || Files.isDirectory(modelPath)) {
            System.err.println("Error: --model must point to an existing JSON file: " + modelPath);
            return 1;
        }

        final OntoModel model;
        try {
            model = ModelJson.read(modelPath);
        } catch (IOException e) {
            System.err.println("Error: could not read model snapshot: " + modelPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final ValidationResult result = new OntoUmlValidationService().validate(model, toOptions(parsed));

        final String modelName = !model.name.isBlank() ? model.name : stripExtension(modelPath.getFileName().toString());

        ConsoleSink sink = new ConsoleSink();
        DiagnosticPublisher.publish(result, sink);
        System.out.println(
                "ontouml-check\n" +
                "- Model: " + modelName + "\n" +
                "- Snapshot: " + modelPath + "\n" +
                "- Errors: " + result.errors().size() + "\n" +
                "- Anti-patterns: " + result.antiPatterns().size()
        );
        sink.render(System.out);

        if (parsed.report != null) {
            final Path reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                MarkdownReportWriter.write(reportOut, modelName, modelPath, result);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
            System.out.println("- Report: " + reportOut);
        }

        if (parsed.failOnProblems && !result.isEmpty()) {
            System.err.println("Problems found (" + result.problems.size() + ") and --fail-on-problems is set.");
            return 3;
        }
        return 0;
    }

    static ValidationOptions toOptions(CliArgs parsed) {
        ValidationOptions o = new ValidationOptions();
        o.checkErrors = parsed.errors;
        o.checkAntipatterns = parsed.antipatterns;
        EnumSet<AntiPatternType> enabled = EnumSet.allOf(AntiPatternType.class);
        enabled.removeAll(parsed.disabled);
        o.enabledAntiPatterns = enabled;
        return o;
    }

    private static String stripExtension(String fileName) {
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0) return fileName;
        return fileName.substring(0, idx);
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        boolean verbose = false;
        String model;
        String report;

        boolean errors = true;
        boolean antipatterns = false;
        final EnumSet<AntiPatternType> disabled = EnumSet.noneOf(AntiPatternType.class);

        boolean failOnProblems = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --disable=BinOver
                if (a.startsWith("--disable=")) {
                    out.disabled.add(AntiPatternType.parse(a.substring("--disable=".length())));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--verbose":
                        out.verbose = true;
                        break;
                    case "--model":
                        out.model = requireValue(args, ++i, "--model");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--errors":
                        out.errors = parseBoolean(requireValue(args, ++i, "--errors"), "--errors");
                        break;
                    case "--antipatterns":
                        out.antipatterns = parseBoolean(requireValue(args, ++i, "--antipatterns"), "--antipatterns");
                        break;
                    case "--disable":
                        out.disabled.add(AntiPatternType.parse(requireValue(args, ++i, "--disable")));
                        break;
                    case "--fail-on-problems":
                        out.failOnProblems = parseBoolean(requireValue(args, ++i, "--fail-on-problems"), "--fail-on-problems");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --model
                        if (out.model == null) {
                            out.model = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            StringBuilder codes = new StringBuilder();
            for (AntiPatternType t : AntiPatternType.values()) {
                if (codes.length() > 0) codes.append(", ");
                codes.append(t.code());
            }
            System.out.println(
                    "ontouml-check\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar ontouml-check.jar --model <file.json> [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --model <file.json>      JSON model snapshot to validate (required; a bare path also works)\n" +
                    "  --errors <bool>          Report structural errors. Default: true\n" +
                    "  --antipatterns <bool>    Report anti-patterns. Default: false\n" +
                    "  --disable <name>         Skip one anti-pattern detector (repeatable, also --disable=<name>).\n" +
                    "                           Names: " + codes + "\n" +
                    "  --report <file.md>       Also write a markdown report\n" +
                    "  --fail-on-problems <bool> Exit with code 3 when any problem is found. Default: false\n" +
                    "  --verbose                Debug logging on stderr\n" +
                    "  -h, --help               Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 bad arguments, 2 I/O failure, 3 problems found with --fail-on-problems\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/ontouml-check.jar samples/marriage.json\n" +
                    "  java -jar target/ontouml-check.jar --model model.json --antipatterns true --disable BinOver\n"
            );
        }
    }
}
