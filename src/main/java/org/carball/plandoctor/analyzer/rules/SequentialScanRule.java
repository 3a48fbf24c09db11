package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.NodeRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.PlanNode;

import java.util.List;

/**
 * Flags full table scans that read many rows or take long.
 */
public class SequentialScanRule extends NodeRule {

    static final String SEQ_SCAN = "Seq Scan";
    public static final String RELATED_NODE_PREFIX = SEQ_SCAN + " on ";

    private final DiagnosticThresholds thresholds;

    public SequentialScanRule(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "sequential-scan";
    }

    @Override
    protected void inspect(PlanNode node, List<Issue> issues) {
        if (!SEQ_SCAN.equals(node.getNodeType()) || !node.hasRelation()) {
            return;
        }

        if (exceeds(node.getActualRows(), thresholds.getSeqScanRowThreshold())
                || exceeds(node.getActualTotalTime(), thresholds.getSeqScanTimeThresholdMs())) {
            Severity severity = exceeds(node.getActualRows(), thresholds.getSeqScanHighSeverityRows())
                    ? Severity.HIGH : Severity.MEDIUM;

            issues.add(Issue.builder()
                    .type(IssueType.SEQUENTIAL_SCAN)
                    .description("Sequential scan on table " + node.getRelation()
                            + " with " + format(node.getActualRows()) + " rows")
                    .severity(severity)
                    .relatedNode(RELATED_NODE_PREFIX + node.getRelation())
                    .suggestedFix("Consider adding an index on columns in the WHERE clause for table "
                            + node.getRelation())
                    .build());
        }
    }
}
