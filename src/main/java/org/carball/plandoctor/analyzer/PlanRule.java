package org.carball.plandoctor.analyzer;

import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;

/**
 * One diagnostic check. Rules are independent of each other and append the issues
 * they find to {@code issues} in a deterministic order.
 */
public interface PlanRule {

    String name();

    void evaluate(QueryPlan plan, List<Issue> issues);
}
