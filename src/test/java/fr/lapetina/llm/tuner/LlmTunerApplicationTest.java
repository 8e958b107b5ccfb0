package fr.lapetina.llm.tuner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LlmTunerApplicationTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream output;
    private LlmTunerApplication application;
    private Path dataset;

    @BeforeEach
    void setUp() throws IOException {
        output = new ByteArrayOutputStream();
        application = new LlmTunerApplication(new PrintStream(output, true, StandardCharsets.UTF_8));
        dataset = dir.resolve("dataset.json");
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("dataset.json")) {
            Files.copy(is, dataset);
        }
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should print usage when arguments are missing")
    void shouldPrintUsage() {
        assertThat(application.run(new String[]{"evaluate"})).isEqualTo(2);
        assertThat(printed()).contains("Usage:").contains("exact-match");
    }

    @Test
    @DisplayName("should reject an unknown metric")
    void shouldRejectUnknownMetric() {
        int code = application.run(new String[]{"evaluate", "test-config.yaml", dataset.toString(), "bleu"});

        assertThat(code).isEqualTo(2);
        assertThat(printed()).contains("Unknown metric: bleu");
    }

    @Test
    @DisplayName("should reject an unknown command")
    void shouldRejectUnknownCommand() {
        int code = application.run(new String[]{"train", "test-config.yaml", dataset.toString(), "exact-match"});

        assertThat(code).isEqualTo(2);
        assertThat(printed()).contains("Unknown command: train");
    }

    @Test
    @DisplayName("should evaluate with the echo backend")
    void shouldEvaluate() {
        // The echo backend of the test configuration always answers "4"
        int code = application.run(new String[]{"evaluate", "test-config.yaml", dataset.toString(), "exact-match"});

        assertThat(code).isZero();
        assertThat(printed())
                .contains("=== Evaluation Results ===")
                .contains("Score: 0.667 (3/3 examples)");
    }

    @Test
    @DisplayName("should optimize and write a run summary")
    void shouldOptimize() throws IOException {
        Path summary = dir.resolve("summary.json");

        int code = application.run(new String[]{
                "optimize", "test-config.yaml", dataset.toString(), "exact-match", summary.toString()});

        assertThat(code).isZero();
        assertThat(printed()).contains("Best score: 0.667 after 2 iterations");
        JsonNode json = new ObjectMapper().readTree(Files.readString(summary));
        assertThat(json.get("total_iterations").asInt()).isEqualTo(2);
        assertThat(json.get("history").size()).isEqualTo(3);
    }
}
