package org.carball.plandoctor.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.analyzer.HealthScorer;
import org.carball.plandoctor.analyzer.PlanTreeWalker;
import org.carball.plandoctor.model.analysis.AnalysisResult;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.QueryPlan;
import org.carball.plandoctor.parser.QueryFingerprinter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
public class AnalysisReport {

    static final String ANALYZER_VERSION = "1.0.0";

    private final AnalysisResult analysisResult;
    private final String query;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnalysisReport(AnalysisResult analysisResult) {
        this(analysisResult, null);
    }

    public AnalysisReport(AnalysisResult analysisResult, String query) {
        this(analysisResult, query, LocalDateTime.now());
    }

    AnalysisReport(AnalysisResult analysisResult, String query, LocalDateTime timestamp) {
        this.analysisResult = analysisResult;
        this.query = query != null ? query : analysisResult.plan().getQuery();
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        QueryPlan plan = analysisResult.plan();
        int score = analysisResult.healthScore();
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Query Plan Analysis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Analyzer Version:** ").append(ANALYZER_VERSION).append("  \n\n");

        md.append("## Health Score: ").append(score).append("/100 (")
                .append(HealthScorer.verdict(score)).append(")\n\n");

        if (query != null) {
            md.append("**Fingerprint:** `").append(QueryFingerprinter.fingerprint(query)).append("`\n\n");
        }

        // Timings
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Execution Time | ").append(millis(plan.getExecutionTime())).append(" |\n");
        md.append("| Planning Time | ").append(millis(plan.getPlanningTime())).append(" |\n");
        md.append("| Plan Nodes | ").append(PlanTreeWalker.count(plan.getPlan())).append(" |\n");
        md.append("| Issues Found | ").append(analysisResult.issues().size()).append(" |\n\n");

        // Issues
        md.append("## Issues\n\n");
        if (analysisResult.issues().isEmpty()) {
            md.append("**No performance issues detected.**\n\n");
        } else {
            md.append("| Severity | Type | Operator | Description | Suggested Fix |\n");
            md.append("|----------|------|----------|-------------|---------------|\n");
            for (Issue issue : analysisResult.issues()) {
                md.append("| ").append(issue.getSeverity().getLabel())
                        .append(" | ").append(issue.getType().getLabel())
                        .append(" | ").append(escape(orDash(issue.getRelatedNode())))
                        .append(" | ").append(escape(issue.getDescription()))
                        .append(" | ").append(escape(orDash(issue.getSuggestedFix())))
                        .append(" |\n");
            }
            md.append("\n");
        }

        // Recommendations
        md.append("## Recommendations\n\n");
        if (analysisResult.recommendations().isEmpty()) {
            md.append("No changes recommended.\n\n");
        } else {
            int recNum = 1;
            for (String recommendation : analysisResult.recommendations()) {
                md.append(recNum++).append(". ").append(recommendation).append("\n");
            }
            md.append("\n");
        }

        if (!plan.getWarnings().isEmpty()) {
            md.append("## Warnings\n\n");
            plan.getWarnings().forEach(warning -> md.append("- ").append(warning).append("\n"));
            md.append("\n");
        }

        // Plan
        md.append("## Execution Plan\n\n");
        md.append("```\n").append(analysisResult.planText());
        if (!analysisResult.planText().endsWith("\n")) {
            md.append("\n");
        }
        md.append("```\n\n");

        // Footer
        md.append("---\n\n");
        md.append("*Generated by plan-doctor*\n");

        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        QueryPlan plan = analysisResult.plan();

        report.setMetadata(new ReportMetadata(
                timestamp,
                ANALYZER_VERSION,
                query != null ? QueryFingerprinter.fingerprint(query) : null,
                PlanTreeWalker.count(plan.getPlan())
        ));
        report.setQuery(query);
        report.setHealthScore(analysisResult.healthScore());
        report.setVerdict(HealthScorer.verdict(analysisResult.healthScore()));
        report.setExecutionTime(plan.getExecutionTime());
        report.setPlanningTime(plan.getPlanningTime());
        report.setSeverityCounts(new SeverityCounts(
                analysisResult.countBySeverity(Severity.LOW),
                analysisResult.countBySeverity(Severity.MEDIUM),
                analysisResult.countBySeverity(Severity.HIGH),
                analysisResult.countBySeverity(Severity.CRITICAL)
        ));
        report.setIssues(analysisResult.issues());
        report.setRecommendations(analysisResult.recommendations());
        report.setPlan(plan);
        report.setPlanText(analysisResult.planText());

        return report;
    }

    private static String millis(double value) {
        return String.format(Locale.ROOT, "%.3f ms", value);
    }

    private static String orDash(String value) {
        return value == null ? "-" : value;
    }

    private static String escape(String cell) {
        return cell.replace("|", "\\|");
    }

    // Inner classes for JSON structure
    @lombok.Data
    static class ReportData {
        private ReportMetadata metadata;
        private String query;
        private int healthScore;
        private String verdict;
        private double executionTime;
        private double planningTime;
        private SeverityCounts severityCounts;
        private List<Issue> issues;
        private List<String> recommendations;
        private QueryPlan plan;
        private String planText;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    static class ReportMetadata {
        private LocalDateTime timestamp;
        private String analyzerVersion;
        private String queryFingerprint;
        private int planNodeCount;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    static class SeverityCounts {
        private long low;
        private long medium;
        private long high;
        private long critical;
    }
}
