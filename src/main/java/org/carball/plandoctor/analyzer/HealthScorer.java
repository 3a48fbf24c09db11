package org.carball.plandoctor.analyzer;

import org.carball.plandoctor.config.DiagnosticThresholds;
import org.carball.plandoctor.model.analysis.Issue;

import java.util.List;

public class HealthScorer {

    public static final int MAX_SCORE = 100;
    public static final int MIN_SCORE = 0;

    private final DiagnosticThresholds thresholds;

    public HealthScorer(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds.copy();
    }

    /**
     * Starts from {@value #MAX_SCORE} and deducts per issue according to its severity,
     * clamped to [{@value #MIN_SCORE}, {@value #MAX_SCORE}].
     */
    public int score(List<Issue> issues) {
        long score = MAX_SCORE;
        for (Issue issue : issues) {
            score -= thresholds.deductionFor(issue.getSeverity());
        }
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static String verdict(int score) {
        if (score >= 80) {
            return "Healthy";
        } else if (score >= 50) {
            return "Needs attention";
        } else {
            return "Critical";
        }
    }
}
