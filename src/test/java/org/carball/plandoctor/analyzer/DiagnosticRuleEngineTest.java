package org.carball.plandoctor.analyzer;

import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.analysis.IssueType;
import org.carball.plandoctor.model.analysis.Severity;
import org.carball.plandoctor.model.plan.PlanNode;
import org.carball.plandoctor.model.plan.QueryPlan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DiagnosticRuleEngineTest {

    private final DiagnosticRuleEngine engine = new DiagnosticRuleEngine(DiagnosticThresholds.defaults());

    @Test
    void shouldRunRulesInFixedOrder() {
        assertThat(engine.getRules())
                .extracting(PlanRule::name)
                .containsExactly(
                        "sequential-scan",
                        "expensive-join",
                        "estimation-error",
                        "temporary-files",
                        "inefficient-index",
                        "missing-parallelism",
                        "high-planning-time");
    }

    @Test
    void shouldGroupIssuesByRuleThenByPlanOrder() {
        // Given
        QueryPlan plan = QueryPlan.builder()
                .executionTime(3000)
                .planningTime(2)
                .plan(PlanNode.builder()
                        .nodeType("Hash Join")
                        .actualRows(60000L)
                        .planRows(50L)
                        .actualTotalTime(2900.0)
                        .child(PlanNode.builder()
                                .nodeType("Seq Scan")
                                .relation("orders")
                                .actualRows(40000L)
                                .planRows(40000L)
                                .build())
                        .child(PlanNode.builder()
                                .nodeType("Sort")
                                .attribute("sortMethod", "external merge")
                                .child(PlanNode.builder()
                                        .nodeType("Seq Scan")
                                        .relation("customers")
                                        .actualRows(2000L)
                                        .planRows(2000L)
                                        .build())
                                .build())
                        .build())
                .build();

        // When
        List<Issue> issues = engine.diagnose(plan);

        // Then
        assertThat(issues)
                .extracting(Issue::getType)
                .containsExactly(
                        IssueType.SEQUENTIAL_SCAN,
                        IssueType.SEQUENTIAL_SCAN,
                        IssueType.EXPENSIVE_JOIN,
                        IssueType.ESTIMATION_ERROR,
                        IssueType.TEMPORARY_FILES,
                        IssueType.MISSING_PARALLELISM);
        assertThat(issues.subList(0, 2))
                .extracting(Issue::getRelatedNode)
                .containsExactly("Seq Scan on orders", "Seq Scan on customers");
        assertThat(issues.get(2).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void shouldReturnNoIssuesForEmptyPlan() {
        assertThat(engine.diagnose(QueryPlan.empty())).isEmpty();
    }

    @Test
    void shouldAcceptCustomRuleList() {
        // Given
        PlanRule alwaysFires = new PlanRule() {
            @Override
            public String name() {
                return "always";
            }

            @Override
            public void evaluate(QueryPlan plan, List<Issue> issues) {
                issues.add(Issue.builder()
                        .type(IssueType.HIGH_PLANNING_TIME)
                        .description("test")
                        .severity(Severity.LOW)
                        .build());
            }
        };
        DiagnosticRuleEngine custom = new DiagnosticRuleEngine(List.of(alwaysFires));

        // When
        List<Issue> issues = custom.diagnose(QueryPlan.empty());

        // Then
        assertThat(issues).singleElement().extracting(Issue::getSeverity).isEqualTo(Severity.LOW);
    }

    @Test
    void shouldReturnImmutableIssueList() {
        // When
        List<Issue> issues = engine.diagnose(QueryPlan.empty());

        // Then
        assertThatThrownBy(() -> issues.add(null)).isInstanceOf(UnsupportedOperationException.class);
    }
}
