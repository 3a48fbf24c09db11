package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.NodeRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.PlanNode;

import java.util.List;

/**
 * Flags operators whose actual row count is far from the planner's estimate, in either
 * direction. Nodes without estimated or actual rows (see {@link #hasRows}) are skipped.
 */
public class EstimationErrorRule extends NodeRule {

    private final DiagnosticThresholds thresholds;

    public EstimationErrorRule(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "estimation-error";
    }

    @Override
    protected void inspect(PlanNode node, List<Issue> issues) {
        Long planRows = node.getPlanRows();
        Long actualRows = node.getActualRows();
        if (!hasRows(planRows) || !hasRows(actualRows)) {
            return;
        }

        double ratio = (double) actualRows / planRows;
        if (outside(ratio, thresholds.getEstimationErrorRatio())) {
            Severity severity = outside(ratio, thresholds.getEstimationHighSeverityRatio())
                    ? Severity.HIGH : Severity.MEDIUM;

            issues.add(Issue.builder()
                    .type(IssueType.ESTIMATION_ERROR)
                    .description("Row estimation error in " + node.getNodeType() + ": estimated "
                            + planRows + ", got " + actualRows)
                    .severity(severity)
                    .relatedNode(node.getNodeType())
                    .suggestedFix("Run ANALYZE on related tables to update statistics")
                    .build());
        }
    }

    private static boolean outside(double ratio, double bound) {
        return ratio > bound || ratio < 1.0 / bound;
    }
}
