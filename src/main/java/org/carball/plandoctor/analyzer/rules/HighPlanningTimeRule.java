package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.PlanRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;

public class HighPlanningTimeRule implements PlanRule {

    private final DiagnosticThresholds thresholds;

    public HighPlanningTimeRule(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "high-planning-time";
    }

    @Override
    public void evaluate(QueryPlan plan, List<Issue> issues) {
        if (plan.getPlanningTime() > plan.getExecutionTime() * thresholds.getPlanningTimeRatio()) {
            issues.add(Issue.builder()
                    .type(IssueType.HIGH_PLANNING_TIME)
                    .description("Planning time is high relative to execution time")
                    .severity(Severity.MEDIUM)
                    .suggestedFix("Consider simplifying the query or creating helper views")
                    .build());
        }
    }
}
