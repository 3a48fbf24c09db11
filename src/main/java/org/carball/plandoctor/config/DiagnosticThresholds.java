package org.carball.plandoctor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.model.analysis.Severity;

import java.util.Locale;

/**
 * Cutoffs used by the diagnostic rules and the health scorer.
 * <p>
 * The defaults are heuristics that have never been calibrated against real workloads.
 * They are kept as-is so that scores stay comparable between runs, and every one of them
 * can be overridden from a YAML file, environment variables or the command line
 * (see {@link ConfigurationLoader}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiagnosticThresholds {

    // Sequential scans
    @Builder.Default
    @JsonProperty("seq_scan_row_threshold")
    private long seqScanRowThreshold = 1000;

    @Builder.Default
    @JsonProperty("seq_scan_time_threshold_ms")
    private double seqScanTimeThresholdMs = 100;

    @Builder.Default
    @JsonProperty("seq_scan_high_severity_rows")
    private long seqScanHighSeverityRows = 10000;

    // Joins
    @Builder.Default
    @JsonProperty("join_row_threshold")
    private long joinRowThreshold = 10000;

    @Builder.Default
    @JsonProperty("join_time_threshold_ms")
    private double joinTimeThresholdMs = 500;

    @Builder.Default
    @JsonProperty("join_high_severity_time_ms")
    private double joinHighSeverityTimeMs = 1000;

    // Row estimates; the lower bound is the reciprocal of each ratio
    @Builder.Default
    @JsonProperty("estimation_error_ratio")
    private double estimationErrorRatio = 10.0;

    @Builder.Default
    @JsonProperty("estimation_high_severity_ratio")
    private double estimationHighSeverityRatio = 100.0;

    // Index scans
    @Builder.Default
    @JsonProperty("index_max_actual_rows")
    private long indexMaxActualRows = 10;

    @Builder.Default
    @JsonProperty("index_min_plan_rows")
    private long indexMinPlanRows = 1000;

    // Whole-plan timings
    @Builder.Default
    @JsonProperty("parallelism_execution_threshold_ms")
    private double parallelismExecutionThresholdMs = 1000;

    @Builder.Default
    @JsonProperty("planning_time_ratio")
    private double planningTimeRatio = 0.5;

    @Builder.Default
    @JsonProperty("caching_execution_threshold_ms")
    private double cachingExecutionThresholdMs = 1000;

    // Health score deductions
    @Builder.Default
    @JsonProperty("low_deduction")
    private int lowDeduction = Severity.LOW.getDefaultDeduction();

    @Builder.Default
    @JsonProperty("medium_deduction")
    private int mediumDeduction = Severity.MEDIUM.getDefaultDeduction();

    @Builder.Default
    @JsonProperty("high_deduction")
    private int highDeduction = Severity.HIGH.getDefaultDeduction();

    @Builder.Default
    @JsonProperty("critical_deduction")
    private int criticalDeduction = Severity.CRITICAL.getDefaultDeduction();

    public static DiagnosticThresholds defaults() {
        return DiagnosticThresholds.builder().build();
    }

    /**
     * Returns an independent instance with the same values.
     */
    public DiagnosticThresholds copy() {
        return toBuilder().build();
    }

    public int deductionFor(Severity severity) {
        switch (severity) {
            case LOW:
                return lowDeduction;
            case MEDIUM:
                return mediumDeduction;
            case HIGH:
                return highDeduction;
            case CRITICAL:
                return criticalDeduction;
            default:
                throw new IllegalArgumentException("Unhandled severity: " + severity);
        }
    }

    /**
     * Logs a warning for every combination of values that would make a rule misbehave.
     * Nothing is rejected; the caller decides what to do with odd settings.
     */
    public void validate() {
        if (seqScanHighSeverityRows <= seqScanRowThreshold) {
            log.warn("Seq scan high-severity rows ({}) should be greater than the seq scan row threshold ({})",
                    seqScanHighSeverityRows, seqScanRowThreshold);
        }

        if (joinHighSeverityTimeMs <= joinTimeThresholdMs) {
            log.warn("Join high-severity time ({}) should be greater than the join time threshold ({})",
                    joinHighSeverityTimeMs, joinTimeThresholdMs);
        }

        if (estimationErrorRatio <= 1.0) {
            log.warn("Estimation error ratio ({}) should be greater than 1.0", estimationErrorRatio);
        }

        if (estimationHighSeverityRatio <= estimationErrorRatio) {
            log.warn("Estimation high-severity ratio ({}) should be greater than the estimation error ratio ({})",
                    estimationHighSeverityRatio, estimationErrorRatio);
        }

        if (indexMinPlanRows <= indexMaxActualRows) {
            log.warn("Index minimum plan rows ({}) should be greater than index maximum actual rows ({})",
                    indexMinPlanRows, indexMaxActualRows);
        }

        if (planningTimeRatio <= 0) {
            log.warn("Planning time ratio ({}) should be positive", planningTimeRatio);
        }

        if (lowDeduction < 0 || mediumDeduction < 0 || highDeduction < 0 || criticalDeduction < 0) {
            log.warn("Severity deductions should not be negative (low={}, medium={}, high={}, critical={})",
                    lowDeduction, mediumDeduction, highDeduction, criticalDeduction);
        }

        log.debug("Using thresholds - {}", getConfigurationSummary());
    }

    public String getConfigurationSummary() {
        return String.format(Locale.ROOT, "Seq scan: %d rows/%.0f ms | Join: %d rows/%.0f ms | Estimate ratio: %.1f | " +
                        "Slow plan: %.0f ms | Deductions: %d/%d/%d/%d",
                seqScanRowThreshold, seqScanTimeThresholdMs, joinRowThreshold, joinTimeThresholdMs,
                estimationErrorRatio, parallelismExecutionThresholdMs,
                lowDeduction, mediumDeduction, highDeduction, criticalDeduction);
    }
}
