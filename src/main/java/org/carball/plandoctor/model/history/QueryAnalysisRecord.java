package org.carball.plandoctor.model.history;

import org.carball.plandoctor.model.analysis.Issue;
import org.carball.plandoctor.model.plan.QueryPlan;

import java.util.List;

/**
 * Row handed to whatever stores analysis history. Rows are grouped by
 * {@code queryFingerprint}; nothing in this project persists them.
 */
public record QueryAnalysisRecord(
    String queryText,
    String queryFingerprint,
    double executionTime,
    QueryPlan plan,
    String planText,
    List<Issue> issues,
    List<String> recommendations,
    int healthScore
) {}
