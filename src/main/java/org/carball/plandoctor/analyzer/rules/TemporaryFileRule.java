package org.carball.plandoctor.analyzer.rules;

import org.carball.plandoctor.analyzer.NodeRule;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.PlanNode;

import java.util.List;

/**
 * Flags operators that spilled to disk.
 * <p>
 * Reads the {@value #SORT_METHOD} and {@value #SORT_SPACE_USED} attributes.
 */
public class TemporaryFileRule extends NodeRule {

    public static final String SORT_METHOD = "sortMethod";
    public static final String SORT_SPACE_USED = "sortSpaceUsed";
    static final String EXTERNAL_MERGE = "external merge";

    @Override
    public String name() {
        return "temporary-files";
    }

    @Override
    protected void inspect(PlanNode node, List<Issue> issues) {
        if (EXTERNAL_MERGE.equals(node.attributeText(SORT_METHOD)) || isPresent(node.attribute(SORT_SPACE_USED))) {
            issues.add(Issue.builder()
                    .type(IssueType.TEMPORARY_FILES)
                    .description("External temporary file used in " + node.getNodeType())
                    .severity(Severity.HIGH)
                    .relatedNode(node.getNodeType())
                    .suggestedFix("Increase work_mem setting or restructure query to reduce memory usage")
                    .build());
        }
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return !value.toString().isBlank();
    }
}
