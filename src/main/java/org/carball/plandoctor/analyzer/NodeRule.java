package org.carball.plandoctor.analyzer;

import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.plan.PlanNode;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;

/**
 * A rule that looks at operators one at a time, in {@link PlanTreeWalker} order.
 */
public abstract class NodeRule implements PlanRule {

    @Override
    public final void evaluate(QueryPlan plan, List<Issue> issues) {
        PlanTreeWalker.walk(plan.getPlan(), node -> inspect(node, issues));
    }

    protected abstract void inspect(PlanNode node, List<Issue> issues);

    /**
     * Whether a row count carries information. Zero is treated like an absent count: it is
     * what the engine reports for an operator that never ran.
     */
    protected static boolean hasRows(Long rows) {
        return rows != null && rows > 0;
    }

    protected static boolean exceeds(Long value, long threshold) {
        return value != null && value > threshold;
    }

    protected static boolean exceeds(Double value, double threshold) {
        return value != null && value > threshold;
    }

    /**
     * Formats a statistic for a description: whole numbers without decimals, absent as "unknown".
     */
    protected static String format(Number value) {
        if (value == null) {
            return "unknown";
        }
        double d = value.doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            return String.valueOf(value.longValue());
        }
        return String.valueOf(d);
    }
}
