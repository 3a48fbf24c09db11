package org.carball.plandoctor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue severity, declared in ascending order so that {@link #compareTo} ranks them.
 */
public enum Severity {
    LOW("low", 5),
    MEDIUM("medium", 10),
    HIGH("high", 20),
    CRITICAL("critical", 40);

    private final String label;
    private final int defaultDeduction;

    Severity(String label, int defaultDeduction) {
        this.label = label;
        this.defaultDeduction = defaultDeduction;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getDefaultDeduction() {
        return defaultDeduction;
    }
}
