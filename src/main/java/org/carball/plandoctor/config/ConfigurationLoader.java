package org.carball.plandoctor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "PLANDOCTOR_";
    static final String CLI_PREFIX = "--thresholds.";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    /**
     * Uses {@code environment} instead of the process environment for {@code PLANDOCTOR_*} overrides.
     */
    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public DiagnosticThresholds loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public DiagnosticThresholds loadConfiguration(Path thresholdsFile, String[] args) {
        log.debug("Loading configuration");

        DiagnosticThresholds base = thresholdsFile != null
                ? loadThresholdsFile(thresholdsFile)
                : DiagnosticThresholds.defaults();
        DiagnosticThresholds.DiagnosticThresholdsBuilder builder = base.toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        DiagnosticThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Reads a YAML thresholds file. Keys missing from the file keep their defaults.
     */
    public DiagnosticThresholds loadThresholdsFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Thresholds file not found: " + path);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            DiagnosticThresholds thresholds = mapper.readerForUpdating(DiagnosticThresholds.defaults())
                    .readValue(path.toFile());
            log.info("Loaded threshold configuration from: {}", path);
            return thresholds;
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid thresholds file " + path + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(DiagnosticThresholds.DiagnosticThresholdsBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                String name = entry.getKey().substring(ENV_PREFIX.length()).toLowerCase().replace('_', '-');
                apply(builder, name, entry.getValue(), entry.getKey());
            }
        }
    }

    private void applyCLIArguments(DiagnosticThresholds.DiagnosticThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(CLI_PREFIX)) {
                apply(builder, args[i].substring(CLI_PREFIX.length()), args[i + 1], args[i]);
            }
        }
    }

    private void apply(DiagnosticThresholds.DiagnosticThresholdsBuilder builder, String name,
                       String value, String source) {
        try {
            switch (name) {
                case "seq-scan-rows":
                    builder.seqScanRowThreshold(Long.parseLong(value));
                    break;
                case "seq-scan-time":
                    builder.seqScanTimeThresholdMs(Double.parseDouble(value));
                    break;
                case "seq-scan-high-rows":
                    builder.seqScanHighSeverityRows(Long.parseLong(value));
                    break;
                case "join-rows":
                    builder.joinRowThreshold(Long.parseLong(value));
                    break;
                case "join-time":
                    builder.joinTimeThresholdMs(Double.parseDouble(value));
                    break;
                case "join-high-time":
                    builder.joinHighSeverityTimeMs(Double.parseDouble(value));
                    break;
                case "estimation-ratio":
                    builder.estimationErrorRatio(Double.parseDouble(value));
                    break;
                case "estimation-high-ratio":
                    builder.estimationHighSeverityRatio(Double.parseDouble(value));
                    break;
                case "index-max-rows":
                    builder.indexMaxActualRows(Long.parseLong(value));
                    break;
                case "index-min-plan-rows":
                    builder.indexMinPlanRows(Long.parseLong(value));
                    break;
                case "parallel-time":
                    builder.parallelismExecutionThresholdMs(Double.parseDouble(value));
                    break;
                case "planning-ratio":
                    builder.planningTimeRatio(Double.parseDouble(value));
                    break;
                case "caching-time":
                    builder.cachingExecutionThresholdMs(Double.parseDouble(value));
                    break;
                case "deduction-low":
                    builder.lowDeduction(Integer.parseInt(value));
                    break;
                case "deduction-medium":
                    builder.mediumDeduction(Integer.parseInt(value));
                    break;
                case "deduction-high":
                    builder.highDeduction(Integer.parseInt(value));
                    break;
                case "deduction-critical":
                    builder.criticalDeduction(Integer.parseInt(value));
                    break;
                default:
                    log.warn("Ignoring unknown threshold setting: {}", source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments (environment variable in brackets):
              --thresholds.seq-scan-rows <num>        Rows that make a seq scan suspicious [PLANDOCTOR_SEQ_SCAN_ROWS]
              --thresholds.seq-scan-time <ms>         Time that makes a seq scan suspicious [PLANDOCTOR_SEQ_SCAN_TIME]
              --thresholds.seq-scan-high-rows <num>   Rows above which a seq scan is high severity
              --thresholds.join-rows <num>            Rows that make a join expensive [PLANDOCTOR_JOIN_ROWS]
              --thresholds.join-time <ms>             Time that makes a join expensive [PLANDOCTOR_JOIN_TIME]
              --thresholds.join-high-time <ms>        Time above which a join is high severity
              --thresholds.estimation-ratio <num>     Actual/estimated row ratio that counts as an error
              --thresholds.estimation-high-ratio <num> Ratio above which the error is high severity
              --thresholds.index-max-rows <num>       Actual rows below which an index scan is inefficient
              --thresholds.index-min-plan-rows <num>  Estimated rows above which an index scan is inefficient
              --thresholds.parallel-time <ms>         Execution time that warrants parallelism
              --thresholds.planning-ratio <num>       Planning/execution ratio that counts as high
              --thresholds.caching-time <ms>          Execution time that triggers the caching advice
              --thresholds.deduction-low <num>        Score deduction per low issue (also medium, high, critical)

            YAML file (--thresholds <file>) uses snake_case keys, e.g. seq_scan_row_threshold: 5000

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Thresholds file
              4. Built-in defaults
            """;
    }
}
