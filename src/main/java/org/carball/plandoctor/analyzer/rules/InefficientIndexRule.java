package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.NodeRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.PlanNode;

import java.util.List;
import java.util.Set;

/**
 * Flags index scans where the planner expected many rows but almost none came back,
 * which points at an index that does not match the query's predicates.
 * <p>
 * Reads the {@value #INDEX_NAME} attribute.
 */
public class InefficientIndexRule extends NodeRule {

    public static final String INDEX_NAME = "indexName";
    private static final Set<String> INDEX_SCANS = Set.of("Index Scan", "Index Only Scan");

    private final DiagnosticThresholds thresholds;

    public InefficientIndexRule(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "inefficient-index";
    }

    @Override
    protected void inspect(PlanNode node, List<Issue> issues) {
        String indexName = node.attributeText(INDEX_NAME);
        if (!INDEX_SCANS.contains(node.getNodeType()) || !node.hasRelation() || indexName == null) {
            return;
        }

        Long actualRows = node.getActualRows();
        if (hasRows(actualRows) && actualRows < thresholds.getIndexMaxActualRows()
                && exceeds(node.getPlanRows(), thresholds.getIndexMinPlanRows())) {
            issues.add(Issue.builder()
                    .type(IssueType.INEFFICIENT_INDEX)
                    .description("Inefficient index " + indexName + " on " + node.getRelation())
                    .severity(Severity.MEDIUM)
                    .relatedNode(node.getNodeType() + " on " + node.getRelation())
                    .suggestedFix("Consider creating a more specific index for this query pattern")
                    .build());
        }
    }
}
