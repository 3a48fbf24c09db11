package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.NodeRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.PlanNode;

import java.util.List;

/**
 * Flags join operators (hash, merge, ...) that produce many rows or take long.
 */
public class ExpensiveJoinRule extends NodeRule {

    private final DiagnosticThresholds thresholds;

    public ExpensiveJoinRule(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "expensive-join";
    }

    @Override
    protected void inspect(PlanNode node, List<Issue> issues) {
        if (!node.getNodeType().contains("Join")) {
            return;
        }

        if (exceeds(node.getActualRows(), thresholds.getJoinRowThreshold())
                || exceeds(node.getActualTotalTime(), thresholds.getJoinTimeThresholdMs())) {
            Severity severity = exceeds(node.getActualTotalTime(), thresholds.getJoinHighSeverityTimeMs())
                    ? Severity.HIGH : Severity.MEDIUM;

            issues.add(Issue.builder()
                    .type(IssueType.EXPENSIVE_JOIN)
                    .description("Expensive " + node.getNodeType() + " producing "
                            + format(node.getActualRows()) + " rows")
                    .severity(severity)
                    .relatedNode(node.getNodeType())
                    .suggestedFix("Consider adding indexes on join columns or restructuring the query")
                    .build());
        }
    }
}
