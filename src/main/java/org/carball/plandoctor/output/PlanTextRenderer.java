package org.carball.plandoctor.output;

import org.carball.plandoctor.model.plan.PlanNode;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;
import java.util.Locale;

/**
 * Renders a plan as indented text, in the style of {@code EXPLAIN ANALYZE} text output.
 * Used for display when the caller did not capture a text plan.
 */
public final class PlanTextRenderer {

    private static final String INDENT = "  ";

    private PlanTextRenderer() {
        // Utility class - prevent instantiation
    }

    public static String render(QueryPlan plan) {
        StringBuilder text = new StringBuilder();
        renderNode(plan.getPlan(), 0, text);

        if (plan.getPlanningTime() > 0) {
            text.append(String.format(Locale.ROOT, "Planning Time: %.3f ms%n", plan.getPlanningTime()));
        }
        if (plan.getExecutionTime() > 0) {
            text.append(String.format(Locale.ROOT, "Execution Time: %.3f ms%n", plan.getExecutionTime()));
        }
        return text.toString();
    }

    private static void renderNode(PlanNode node, int depth, StringBuilder text) {
        text.append(INDENT.repeat(depth)).append("-> ").append(node.getNodeType());
        if (node.hasRelation()) {
            text.append(" on ").append(node.getRelation());
        }

        if (node.getTotalCost() != null) {
            text.append(String.format(Locale.ROOT, "  (cost=%.2f..%.2f rows=%s width=%s)",
                    orZero(node.getStartupCost()), node.getTotalCost(),
                    orUnknown(node.getPlanRows()), orUnknown(node.getPlanWidth())));
        }
        if (node.getActualTotalTime() != null) {
            text.append(String.format(Locale.ROOT, " (actual time=%.3f..%.3f rows=%s loops=%s)",
                    orZero(node.getActualStartupTime()), node.getActualTotalTime(),
                    orUnknown(node.getActualRows()), orUnknown(node.getActualLoops())));
        }
        text.append(System.lineSeparator());

        List<PlanNode> children = node.getChildren();
        for (PlanNode child : children) {
            if (child != null) {
                renderNode(child, depth + 1, text);
            }
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }

    private static String orUnknown(Long value) {
        return value == null ? "?" : value.toString();
    }
}
