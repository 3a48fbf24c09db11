package org.carball.plandoctor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    SEQUENTIAL_SCAN("sequential_scan"),
    EXPENSIVE_JOIN("expensive_join"),
    ESTIMATION_ERROR("estimation_error"),
    TEMPORARY_FILES("temporary_files"),
    INEFFICIENT_INDEX("inefficient_index"),
    MISSING_PARALLELISM("missing_parallelism"),
    HIGH_PLANNING_TIME("high_planning_time");

    private final String label;

    IssueType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
