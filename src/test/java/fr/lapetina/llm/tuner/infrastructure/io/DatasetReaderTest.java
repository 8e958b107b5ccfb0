package fr.lapetina.llm.tuner.infrastructure.io;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import fr.lapetina.llm.tuner.evaluate.UnsupportedDatasetException;
import fr.lapetina.llm.tuner.infrastructure.io.dto.RunSummary;
import fr.lapetina.llm.tuner.optimize.Candidate;
import fr.lapetina.llm.tuner.optimize.HistoryEntry;
import fr.lapetina.llm.tuner.optimize.OptimizationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetReaderTest {

    private DatasetReader reader;

    @BeforeEach
    void setUp() {
        reader = new DatasetReader();
    }

    @Test
    @DisplayName("should read a question/answer dataset from the classpath")
    void shouldReadDataset() throws Exception {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("dataset.json")) {
            List<Map<String, Object>> dataset = reader.read(is);

            assertThat(dataset).hasSize(3);
            assertThat(dataset.get(2)).containsEntry("question", "capital of France").containsEntry("answer", "Paris");
        }
    }

    @Test
    @DisplayName("should normalize a pairs dataset")
    void shouldReadPairs() throws Exception {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("pairs-dataset.json")) {
            List<Map<String, Object>> dataset = reader.read(is);

            assertThat(dataset).containsExactly(
                    Map.of("question", "2+2", "answer", "4"),
                    Map.of("question", "1+1", "answer", "2"));
        }
    }

    @Test
    @DisplayName("should reject JSON that is not an array")
    void shouldRejectNonArray() {
        assertThatThrownBy(() -> reader.parse("{\"question\": \"q\"}"))
                .isInstanceOf(UnsupportedDatasetException.class);
    }

    @Test
    @DisplayName("should wrap missing files")
    void shouldWrapMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("missing.json")))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("should write a run summary with snake_case fields")
    void shouldWriteRunSummary(@TempDir Path dir) throws Exception {
        Pipeline pipeline = input -> CompletableFuture.completedFuture(Map.of());
        Candidate best = Candidate.initial(pipeline).withScore(0.75);
        OptimizationResult result = new OptimizationResult(best, 0.75,
                List.of(new HistoryEntry(0, 0.75, best, System.currentTimeMillis(), 12, 1)), 0, 20, false);
        Path out = dir.resolve("summary.json");

        reader.write(out, RunSummary.from("run-1", result));

        JsonNode json = reader.getObjectMapper().readTree(Files.readString(out));
        assertThat(json.get("run_id").asText()).isEqualTo("run-1");
        assertThat(json.get("best_score").asDouble()).isEqualTo(0.75);
        assertThat(json.get("total_iterations").asInt()).isZero();
        assertThat(json.get("history").get(0).get("candidates_evaluated").asInt()).isEqualTo(1);
        assertThat(json.get("completed_at").isTextual()).isTrue();
    }
}
