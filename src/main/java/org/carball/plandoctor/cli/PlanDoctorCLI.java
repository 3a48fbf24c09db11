package org.carball.plandoctor.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.analyzer.HealthScorer;
import org.carball.plandoctor.analyzer.QueryPlanAnalyzer;
import org.carball.plandoctor.config.ConfigurationLoader;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.config.OutputFormat;
import org.carball.plandoctor.config.PlanDoctorConfig;
import org.carball.plandoctor.model.analysis.AnalysisResult;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.QueryPlan;
import org.carball.plandoctor.output.AnalysisReport;
import org.carball.plandoctor.parser.PlanFileReader;
import org.carball.plandoctor.parser.QueryFingerprinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class PlanDoctorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════╗
        ║     Query Plan Diagnostics (plan-doctor) v%s     ║
        ╚═══════════════════════════════════════════════╝
        """;

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;
    private final PlanFileReader planFileReader;

    public PlanDoctorCLI(PrintStream out, PrintStream err) {
        this(out, err, new ConfigurationLoader(), new PlanFileReader());
    }

    PlanDoctorCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader,
                  PlanFileReader planFileReader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
        this.planFileReader = planFileReader;
    }

    public static void main(String[] args) {
        int exitCode = new PlanDoctorCLI(System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the command and returns the process exit code.
     */
    public int run(String[] args) {
        out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }
        if (args.length < 1) {
            printUsage();
            return 1;
        }

        try {
            PlanDoctorConfig config = parseArgs(args);

            out.println("\n🔍 Analyzing plan: " + config.getPlanFile());

            QueryPlan plan = planFileReader.readPlan(config.getPlanFile());
            String planText = config.getTextPlanFile() != null
                    ? planFileReader.readText(config.getTextPlanFile()) : null;
            String query = config.getQueryFile() != null
                    ? planFileReader.readText(config.getQueryFile()).trim() : plan.getQuery();

            QueryPlanAnalyzer analyzer = new QueryPlanAnalyzer(config.getThresholds());
            AnalysisResult result = analyzer.analyze(plan, planText, config.getExecutionTime());

            List<Path> written = outputResults(result, query, config);
            printSummary(result, query, config.isVerbose());

            out.println("\n✅ Analysis complete!");
            written.forEach(path -> out.println("   Output file: " + path));
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("\nUsage: java -jar plan-doctor.jar <plan-file.json> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  plan-file           Output of EXPLAIN (ANALYZE, FORMAT JSON)");
        out.println();
        out.println("Options:");
        out.println("  --text-plan         Text EXPLAIN ANALYZE output to show in the report");
        out.println("  --query             File with the SQL text, used for the fingerprint");
        out.println("  --execution-time    Measured execution time in ms, used when the plan has none");
        out.println("  --output, -o        Output file for the report (default: plan-analysis.json)");
        out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        out.println("  --thresholds        YAML file with custom rule thresholds (optional)");
        out.println("  --verbose, -v       Print every issue in the summary");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getThresholdHelp());
    }

    PlanDoctorConfig parseArgs(String[] args) {
        PlanDoctorConfig config = new PlanDoctorConfig();
        config.setPlanFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("plan-analysis.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        Path thresholdsFile = null;

        // Parse optional arguments
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--thresholds.")) {
                // Applied by the configuration loader
                requireValue(args, i, "Threshold value not specified for " + arg);
                i++;
                continue;
            }

            switch (arg) {
                case "--text-plan":
                    config.setTextPlanFile(Paths.get(requireValue(args, i++, "Text plan file not specified")));
                    break;

                case "--query":
                    config.setQueryFile(Paths.get(requireValue(args, i++, "Query file not specified")));
                    break;

                case "--execution-time":
                    String time = requireValue(args, i++, "Execution time not specified");
                    try {
                        config.setExecutionTime(Double.parseDouble(time));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid execution time: " + time);
                    }
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--thresholds":
                    thresholdsFile = Paths.get(requireValue(args, i++, "Thresholds file not specified"));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        DiagnosticThresholds thresholds = configurationLoader.loadConfiguration(thresholdsFile, args);
        config.setThresholds(thresholds);

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        config.setOutputFile(baseFileName + (config.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            // Check if this is a path with directories
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(PlanDoctorConfig config) {
        if (!Files.exists(config.getPlanFile())) {
            throw new IllegalArgumentException("Plan file not found: " + config.getPlanFile());
        }

        if (config.getTextPlanFile() != null && !Files.exists(config.getTextPlanFile())) {
            throw new IllegalArgumentException("Text plan file not found: " + config.getTextPlanFile());
        }

        if (config.getQueryFile() != null && !Files.exists(config.getQueryFile())) {
            throw new IllegalArgumentException("Query file not found: " + config.getQueryFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private List<Path> outputResults(AnalysisResult result, String query, PlanDoctorConfig config) throws IOException {
        AnalysisReport report = new AnalysisReport(result, query);
        String baseFileName = removeFileExtension(config.getOutputFile());
        List<Path> written = new ArrayList<>();

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Path jsonFile = Paths.get(baseFileName + ".json");
            Files.writeString(jsonFile, report.toJson());
            written.add(jsonFile);
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Path markdownFile = Paths.get(baseFileName + ".md");
            Files.writeString(markdownFile, report.toMarkdown());
            written.add(markdownFile);
        }

        return written;
    }

    private void printSummary(AnalysisResult result, String query, boolean verbose) {
        out.println("\n" + "=".repeat(60));
        out.println("📊 ANALYSIS SUMMARY");
        out.println("=".repeat(60));

        out.printf("%nHealth score: %d/100 (%s)%n", result.healthScore(), HealthScorer.verdict(result.healthScore()));
        if (query != null) {
            out.println("Query fingerprint: " + QueryFingerprinter.fingerprint(query));
        }

        out.println("\nIssues found: " + result.issues().size());
        out.println("  🔴 Critical: " + result.countBySeverity(Severity.CRITICAL));
        out.println("  🟠 High: " + result.countBySeverity(Severity.HIGH));
        out.println("  🟡 Medium: " + result.countBySeverity(Severity.MEDIUM));
        out.println("  🟢 Low: " + result.countBySeverity(Severity.LOW));

        if (verbose) {
            for (Issue issue : result.issues()) {
                out.printf("  - [%s] %s%n", issue.getSeverity().getLabel(), issue.getDescription());
            }
        }

        if (result.recommendations().isEmpty()) {
            out.println("\n💡 No recommendations - the plan looks healthy.");
        } else {
            out.println("\n🎯 Recommendations:");
            out.println("-".repeat(60));
            result.recommendations().forEach(rec -> out.println("  • " + rec));
        }
    }
}
