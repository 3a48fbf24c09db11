package org.carball.plandoctor.analyzer;

import org.carball.plandoctor.analyzer.rules.SequentialScanRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns issues into advice: one recommendation per issue type, however often it occurred.
 */
public class RecommendationGenerator {

    static final String CACHING_ADVICE = "Consider caching frequently accessed query results";

    private static final List<IssueType> ORDER = List.of(
            IssueType.SEQUENTIAL_SCAN,
            IssueType.ESTIMATION_ERROR,
            IssueType.EXPENSIVE_JOIN,
            IssueType.TEMPORARY_FILES,
            IssueType.INEFFICIENT_INDEX,
            IssueType.MISSING_PARALLELISM
    );

    private static final Map<IssueType, String> FIXED_ADVICE = Map.of(
            IssueType.ESTIMATION_ERROR,
            "Run ANALYZE on tables with statistics errors to improve query planning",
            IssueType.EXPENSIVE_JOIN,
            "Review join conditions and add appropriate indexes for join columns",
            IssueType.TEMPORARY_FILES,
            "Increase work_mem setting or break down the query into smaller operations",
            IssueType.INEFFICIENT_INDEX,
            "Consider creating more specific indexes that better match query patterns",
            IssueType.MISSING_PARALLELISM,
            "Enable parallel query execution for this operation (increase max_parallel_workers)"
    );

    private final DiagnosticThresholds thresholds;

    public RecommendationGenerator(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds.copy();
    }

    public List<String> generate(QueryPlan plan, List<Issue> issues) {
        Map<IssueType, List<Issue>> issuesByType = issues.stream()
                .collect(Collectors.groupingBy(Issue::getType, () -> new EnumMap<>(IssueType.class),
                        Collectors.toList()));

        List<String> recommendations = new ArrayList<>();
        for (IssueType type : ORDER) {
            List<Issue> group = issuesByType.get(type);
            if (group == null) {
                continue;
            }

            if (type == IssueType.SEQUENTIAL_SCAN) {
                Set<String> tables = scannedTables(group);
                if (!tables.isEmpty()) {
                    recommendations.add("Consider adding indexes for tables: " + String.join(", ", tables));
                }
            } else {
                recommendations.add(FIXED_ADVICE.get(type));
            }
        }

        if (plan.getExecutionTime() > thresholds.getCachingExecutionThresholdMs()) {
            recommendations.add(CACHING_ADVICE);
        }

        return List.copyOf(recommendations);
    }

    private static Set<String> scannedTables(List<Issue> sequentialScans) {
        Set<String> tables = new LinkedHashSet<>();
        for (Issue issue : sequentialScans) {
            String relatedNode = issue.getRelatedNode();
            if (relatedNode == null) {
                continue;
            }
            String table = relatedNode.startsWith(SequentialScanRule.RELATED_NODE_PREFIX)
                    ? relatedNode.substring(SequentialScanRule.RELATED_NODE_PREFIX.length())
                    : relatedNode;
            if (!table.isEmpty()) {
                tables.add(table);
            }
        }
        return tables;
    }
}
