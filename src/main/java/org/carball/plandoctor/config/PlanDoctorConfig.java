package org.carball.plandoctor.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class PlanDoctorConfig {
    private Path planFile;
    private Path textPlanFile;
    private Path queryFile;
    private Double executionTime;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
    private DiagnosticThresholds thresholds;
}
