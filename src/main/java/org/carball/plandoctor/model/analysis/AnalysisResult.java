package org.carball.plandoctor.model.analysis;

import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;

/**
 * Outcome of diagnosing one plan. The plan text is carried for display only.
 */
public record AnalysisResult(
    QueryPlan plan,
    String planText,
    List<Issue> issues,
    List<String> recommendations,
    int healthScore
) {
    public AnalysisResult {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    public long countBySeverity(Severity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .count();
    }
}
