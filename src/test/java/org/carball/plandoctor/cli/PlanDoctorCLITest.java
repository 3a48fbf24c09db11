package org.carball.plandoctor.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.plandoctor.config.ConfigurationLoader;
import org.carball.plandoctor.config.OutputFormat;
import org.carball.plandoctor.config.PlanDoctorConfig;
import org.carball.plandoctor.parser.PlanFileReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlanDoctorCLITest {

    private static final String SLOW_PLAN = """
        [
          {
            "Plan": {
              "Node Type": "Seq Scan",
              "Relation Name": "orders",
              "Plan Rows": 100,
              "Actual Rows": 50000,
              "Actual Total Time": 250
            },
            "Planning Time": 0.3,
            "Execution Time": 260.1
          }
        ]
        """;

    @TempDir
    Path tempDir;

    private Path planFile;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private PlanDoctorCLI cli;

    @BeforeEach
    void setUp() throws IOException {
        planFile = tempDir.resolve("plan.json");
        Files.writeString(planFile, SLOW_PLAN);

        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new PlanDoctorCLI(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new ConfigurationLoader(Map.<String, String>of()),
                new PlanFileReader());
    }

    @Test
    void shouldWriteJsonReport() throws IOException {
        // Given
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = cli.run(new String[]{planFile.toString(), "-o", output.toString()});

        // Then
        assertThat(exitCode).isZero();
        assertThat(output).exists();

        JsonNode report = new ObjectMapper().readTree(Files.readString(output));
        assertThat(report.get("healthScore").asInt()).isEqualTo(60);
        assertThat(report.get("issues").size()).isEqualTo(2);

        String console = out.toString(StandardCharsets.UTF_8);
        assertThat(console).contains("Health score: 60/100 (Needs attention)");
        assertThat(console).contains("Consider adding indexes for tables: orders");
    }

    @Test
    void shouldWriteBothFormats() {
        // Given
        Path output = tempDir.resolve("report");

        // When
        int exitCode = cli.run(new String[]{planFile.toString(), "--output", output.toString(), "--format", "both"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("report.json")).exists();
        assertThat(tempDir.resolve("report.md")).exists();
    }

    @Test
    void shouldUseQueryFileAndTextPlan() throws IOException {
        // Given
        Path queryFile = tempDir.resolve("query.sql");
        Files.writeString(queryFile, "SELECT * FROM orders WHERE id = 42\n");
        Path textPlan = tempDir.resolve("plan.txt");
        Files.writeString(textPlan, "Seq Scan on orders  (cost=0.00..1834.00 rows=100 width=97)\n");
        Path output = tempDir.resolve("report.md");

        // When
        int exitCode = cli.run(new String[]{
                planFile.toString(),
                "--query", queryFile.toString(),
                "--text-plan", textPlan.toString(),
                "-f", "markdown",
                "-o", output.toString()});

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(output))
                .contains("**Fingerprint:** `SELECT * FROM orders WHERE id = N`")
                .contains("Seq Scan on orders  (cost=0.00..1834.00 rows=100 width=97)");
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Query fingerprint: SELECT * FROM orders WHERE id = N");
    }

    @Test
    void shouldApplyThresholdOverrides() throws IOException {
        // Given
        Path output = tempDir.resolve("lenient.json");

        // When
        int exitCode = cli.run(new String[]{
                planFile.toString(),
                "--thresholds.seq-scan-rows", "100000",
                "--thresholds.seq-scan-time", "1000",
                "-o", output.toString()});

        // Then
        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(Files.readString(output));
        assertThat(report.get("issues").size()).isEqualTo(1);
        assertThat(report.get("issues").get(0).get("type").asText()).isEqualTo("estimation_error");
    }

    @Test
    void shouldPrintHelp() {
        // When
        int exitCode = cli.run(new String[]{"--help"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Usage: java -jar plan-doctor.jar")
                .contains("--thresholds.seq-scan-rows");
    }

    @Test
    void shouldFailWithoutArguments() {
        assertThat(cli.run(new String[0])).isEqualTo(1);
    }

    @Test
    void shouldFailForMissingPlanFile() {
        // When
        int exitCode = cli.run(new String[]{tempDir.resolve("missing.json").toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Plan file not found");
    }

    @Test
    void shouldFailForUnknownOption() {
        // When
        int exitCode = cli.run(new String[]{planFile.toString(), "--bogus"});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unknown option: --bogus");
    }

    @Test
    void shouldParseArguments() {
        // When
        PlanDoctorConfig config = cli.parseArgs(new String[]{
                planFile.toString(),
                "--execution-time", "1250.5",
                "-f", "markdown",
                "-o", tempDir.resolve("out.json").toString(),
                "-v"});

        // Then
        assertThat(config.getExecutionTime()).isEqualTo(1250.5);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(config.getOutputFile()).endsWith("out.md");
        assertThat(config.isVerbose()).isTrue();
        assertThat(config.getThresholds()).isNotNull();
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> cli.parseArgs(new String[]{planFile.toString(), "--execution-time", "soon"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid execution time");
        assertThatThrownBy(() -> cli.parseArgs(new String[]{planFile.toString(), "--format", "xml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
        assertThatThrownBy(() -> cli.parseArgs(new String[]{planFile.toString(), "--output"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output file not specified");
    }

    @Test
    void shouldRemoveFileExtension() {
        assertThat(PlanDoctorCLI.removeFileExtension("report.json")).isEqualTo("report");
        assertThat(PlanDoctorCLI.removeFileExtension("out/report")).isEqualTo("out/report");
        assertThat(PlanDoctorCLI.removeFileExtension("my.dir/report")).isEqualTo("my.dir/report");
        assertThat(PlanDoctorCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
    }
}
