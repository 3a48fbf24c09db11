package org.carball.plandoctor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.AnalysisResult;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.history.QueryAnalysisRecord;
import org.carball.plandoctor.model.plan.QueryPlan;
import org.carball.plandoctor.output.PlanTextRenderer;
import org.carball.plandoctor.parser.PlanParser;
import org.carball.plandoctor.parser.QueryFingerprinter;

import java.util.List;

/**
 * Entry point of the diagnostic pipeline: parse, run the rules, then recommend and score.
 * <p>
 * Instances hold no per-call state and may be shared between threads.
 */
@Slf4j
public class QueryPlanAnalyzer {

    private final PlanParser planParser;
    private final DiagnosticRuleEngine ruleEngine;
    private final RecommendationGenerator recommendationGenerator;
    private final HealthScorer healthScorer;

    public QueryPlanAnalyzer() {
        this(DiagnosticThresholds.defaults());
    }

    /**
     * Each component keeps its own copy of {@code thresholds}; later changes to the caller's
     * instance do not affect this analyzer.
     */
    public QueryPlanAnalyzer(DiagnosticThresholds thresholds) {
        this(new PlanParser(), new DiagnosticRuleEngine(thresholds),
                new RecommendationGenerator(thresholds), new HealthScorer(thresholds));
    }

    public QueryPlanAnalyzer(PlanParser planParser,
                             DiagnosticRuleEngine ruleEngine,
                             RecommendationGenerator recommendationGenerator,
                             HealthScorer healthScorer) {
        this.planParser = planParser;
        this.ruleEngine = ruleEngine;
        this.recommendationGenerator = recommendationGenerator;
        this.healthScorer = healthScorer;
    }

    public AnalysisResult analyze(Object rawPlan) {
        return analyze(rawPlan, null, null);
    }

    public AnalysisResult analyze(Object rawPlan, String planText) {
        return analyze(rawPlan, planText, null);
    }

    /**
     * Analyzes a raw plan as captured by the caller.
     *
     * @param rawPlan               JSON plan as text, {@code JsonNode} or Map/List graph
     * @param planText              text rendering for display, or null to render one
     * @param measuredExecutionTime wall-clock time measured by the caller, used when the
     *                              plan itself carries no execution time
     */
    public AnalysisResult analyze(Object rawPlan, String planText, Double measuredExecutionTime) {
        return analyze(planParser.parse(rawPlan), planText, measuredExecutionTime);
    }

    public AnalysisResult analyze(QueryPlan plan) {
        return analyze(plan, null, null);
    }

    public AnalysisResult analyze(QueryPlan plan, String planText) {
        return analyze(plan, planText, null);
    }

    public AnalysisResult analyze(QueryPlan plan, String planText, Double measuredExecutionTime) {
        if (plan.getExecutionTime() == 0 && measuredExecutionTime != null && measuredExecutionTime > 0) {
            log.debug("Plan has no execution time, using measured time {} ms", measuredExecutionTime);
            plan = plan.toBuilder().executionTime(measuredExecutionTime).build();
        }

        log.debug("Analyzing plan with {} node(s), execution {} ms, planning {} ms",
                PlanTreeWalker.count(plan.getPlan()), plan.getExecutionTime(), plan.getPlanningTime());

        List<Issue> issues = ruleEngine.diagnose(plan);
        List<String> recommendations = recommendationGenerator.generate(plan, issues);
        int healthScore = healthScorer.score(issues);

        String text = planText == null || planText.isBlank() ? PlanTextRenderer.render(plan) : planText;

        log.info("Plan analysis complete. Found {} issue(s), health score {}", issues.size(), healthScore);

        return new AnalysisResult(plan, text, issues, recommendations, healthScore);
    }

    /**
     * Packages a result for the history store, keyed by the fingerprint of {@code query}.
     */
    public QueryAnalysisRecord toRecord(String query, AnalysisResult result, double executionTime) {
        return new QueryAnalysisRecord(
                query,
                QueryFingerprinter.fingerprint(query),
                executionTime,
                result.plan(),
                result.planText(),
                result.issues(),
                result.recommendations(),
                result.healthScore()
        );
    }
}
