package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.PlanRule;
import org.carball.plandoctor.analyzer.PlanTreeWalker;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;

/**
 * Flags slow statements whose plan contains no parallel operator at all.
 */
public class MissingParallelismRule implements PlanRule {

    private final DiagnosticThresholds thresholds;

    public MissingParallelismRule(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "missing-parallelism";
    }

    @Override
    public void evaluate(QueryPlan plan, List<Issue> issues) {
        if (plan.getExecutionTime() <= thresholds.getParallelismExecutionThresholdMs()) {
            return;
        }

        boolean parallel = PlanTreeWalker.anyMatch(plan.getPlan(), node -> node.getNodeType().contains("Parallel"));
        if (!parallel) {
            issues.add(Issue.builder()
                    .type(IssueType.MISSING_PARALLELISM)
                    .description("Query is slow but not utilizing parallel execution")
                    .severity(Severity.MEDIUM)
                    .suggestedFix("Consider enabling parallel query execution or restructuring the query")
                    .build());
        }
    }
}
