package org.carball.plandoctor.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        DiagnosticThresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds).isEqualTo(DiagnosticThresholds.defaults());
    }

    @Test
    void shouldApplyCliOverrides() {
        // Given
        String[] args = {
                "plan.json",
                "--thresholds.seq-scan-rows", "5000",
                "--thresholds.estimation-ratio", "20",
                "--thresholds.deduction-high", "30"
        };

        // When
        DiagnosticThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(5000);
        assertThat(thresholds.getEstimationErrorRatio()).isEqualTo(20.0);
        assertThat(thresholds.getHighDeduction()).isEqualTo(30);
        assertThat(thresholds.getJoinRowThreshold()).isEqualTo(10000);
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "PLANDOCTOR_JOIN_ROWS", "25000",
                "PLANDOCTOR_PLANNING_RATIO", "0.8",
                "PATH", "/usr/bin"));

        // When
        DiagnosticThresholds thresholds = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getJoinRowThreshold()).isEqualTo(25000);
        assertThat(thresholds.getPlanningTimeRatio()).isEqualTo(0.8);
    }

    @Test
    void shouldPreferCliOverEnvironment() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("PLANDOCTOR_SEQ_SCAN_ROWS", "3000"));
        String[] args = {"--thresholds.seq-scan-rows", "7000"};

        // When
        DiagnosticThresholds thresholds = envLoader.loadConfiguration(args);

        // Then - CLI > env vars > defaults
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(7000);
    }

    @Test
    void shouldLoadThresholdsFile() throws IOException {
        // Given
        Path file = tempDir.resolve("thresholds.yml");
        Files.writeString(file, """
            seq_scan_row_threshold: 2500
            join_time_threshold_ms: 750.5
            critical_deduction: 50
            some_future_setting: true
            """);

        // When
        DiagnosticThresholds thresholds = loader.loadThresholdsFile(file);

        // Then - keys missing from the file keep their defaults
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(2500);
        assertThat(thresholds.getJoinTimeThresholdMs()).isEqualTo(750.5);
        assertThat(thresholds.getCriticalDeduction()).isEqualTo(50);
        assertThat(thresholds.getSeqScanHighSeverityRows()).isEqualTo(10000);
        assertThat(thresholds.getLowDeduction()).isEqualTo(5);
    }

    @Test
    void shouldLayerEnvironmentAndCliOverFile() throws IOException {
        // Given
        Path file = tempDir.resolve("thresholds.yml");
        Files.writeString(file, """
            seq_scan_row_threshold: 2500
            join_row_threshold: 4000
            index_min_plan_rows: 500
            """);
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("PLANDOCTOR_JOIN_ROWS", "6000"));
        String[] args = {"--thresholds.index-min-plan-rows", "800"};

        // When
        DiagnosticThresholds thresholds = envLoader.loadConfiguration(file, args);

        // Then
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(2500);
        assertThat(thresholds.getJoinRowThreshold()).isEqualTo(6000);
        assertThat(thresholds.getIndexMinPlanRows()).isEqualTo(800);
    }

    @Test
    void shouldThrowExceptionForMissingThresholdsFile() {
        // Given
        Path missing = tempDir.resolve("missing.yml");

        // When/Then
        assertThatThrownBy(() -> loader.loadThresholdsFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Thresholds file not found");
    }

    @Test
    void shouldThrowExceptionForMalformedThresholdsFile() throws IOException {
        // Given
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "seq_scan_row_threshold: [not, a, number");

        // When/Then
        assertThatThrownBy(() -> loader.loadThresholdsFile(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid thresholds file");
    }

    @Test
    void shouldIgnoreInvalidAndUnknownValues() {
        // Given
        String[] args = {
                "--thresholds.seq-scan-rows", "lots",
                "--thresholds.no-such-setting", "5"
        };

        // When
        DiagnosticThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds).isEqualTo(DiagnosticThresholds.defaults());
    }

    @Test
    void shouldDescribeThresholdOptions() {
        // When
        String help = ConfigurationLoader.getThresholdHelp();

        // Then
        assertThat(help)
                .contains("--thresholds.seq-scan-rows")
                .contains("PLANDOCTOR_SEQ_SCAN_ROWS")
                .contains("Priority Order");
    }
}
