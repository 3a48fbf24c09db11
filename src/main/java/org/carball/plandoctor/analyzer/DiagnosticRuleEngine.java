package org.carball.plandoctor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.analyzer.rules.EstimationErrorRule;
import org.carball.plandoctor.analyzer.rules.ExpensiveJoinRule;
import org.carball.plandoctor.analyzer.rules.HighPlanningTimeRule;
import org.carball.plandoctor.analyzer.rules.InefficientIndexRule;
import org.carball.plandoctor.analyzer.rules.MissingParallelismRule;
import org.carball.plandoctor.analyzer.rules.SequentialScanRule;
import org.carball.plandoctor.analyzer.rules.TemporaryFileRule;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the diagnostic rules over a plan in a fixed order.
 * <p>
 * The order is part of the output contract: issues appear grouped by rule, in the order
 * below, and within a per-node rule in plan pre-order.
 */
@Slf4j
public class DiagnosticRuleEngine {

    private final List<PlanRule> rules;

    public DiagnosticRuleEngine(DiagnosticThresholds thresholds) {
        this(defaultRules(thresholds.copy()));
    }

    public DiagnosticRuleEngine(List<PlanRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<PlanRule> defaultRules(DiagnosticThresholds thresholds) {
        return List.of(
                new SequentialScanRule(thresholds),
                new ExpensiveJoinRule(thresholds),
                new EstimationErrorRule(thresholds),
                new TemporaryFileRule(),
                new InefficientIndexRule(thresholds),
                new MissingParallelismRule(thresholds),
                new HighPlanningTimeRule(thresholds)
        );
    }

    public List<Issue> diagnose(QueryPlan plan) {
        List<Issue> issues = new ArrayList<>();

        for (PlanRule rule : rules) {
            int before = issues.size();
            rule.evaluate(plan, issues);
            log.debug("Rule {} reported {} issue(s)", rule.name(), issues.size() - before);
        }

        return List.copyOf(issues);
    }

    public List<PlanRule> getRules() {
        return rules;
    }
}
