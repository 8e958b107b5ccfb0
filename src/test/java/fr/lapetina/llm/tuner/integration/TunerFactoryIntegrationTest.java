package fr.lapetina.llm.tuner.integration;

import fr.lapetina.llm.tuner.domain.backend.BackendException;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import fr.lapetina.llm.tuner.evaluate.EvaluationResult;
import fr.lapetina.llm.tuner.evaluate.Metrics;
import fr.lapetina.llm.tuner.middleware.CircuitOpenException;
import fr.lapetina.llm.tuner.optimize.OptimizationResult;
import fr.lapetina.llm.tuner.optimize.OptimizerOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests through configuration, middleware, pipeline, evaluator and optimizer,
 * with a stub backend under the configured middleware.
 */
class TunerFactoryIntegrationTest {

    private TestTunerFactory factory;
    private List<Map<String, Object>> dataset;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestTunerFactory.create();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("dataset.json")) {
            dataset = factory.getDatasetReader().read(is);
        }
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should wire the configuration")
    void shouldWireConfiguration() {
        assertThat(factory.getConfig().getOptimization().getBeamWidth()).isEqualTo(2);
        assertThat(factory.getMetricsRegistry()).isNotNull();
        assertThat(factory.evaluationOptions().parallel()).isTrue();
        assertThat(factory.optimizerOptions().exampleTimeoutMs()).isEqualTo(2000);
        assertThat(factory.getBackendRegistry().getAvailableProviders()).contains("echo");
    }

    @Test
    @DisplayName("should evaluate a dataset end to end")
    void shouldEvaluateDataset() {
        factory.setAnswer("4");

        EvaluationResult result = factory.getEvaluator()
                .evaluate(factory.getPipeline(), dataset, Metrics.exactMatch(), factory.evaluationOptions())
                .join();

        assertThat(result.total()).isEqualTo(3);
        assertThat(result.count()).isEqualTo(3);
        assertThat(result.score()).isEqualTo(2.0 / 3.0);
        assertThat(factory.getMetricsRegistry().scrape()).contains("test_tuner_backend_calls_total");
    }

    @Test
    @DisplayName("should record backend failures as example errors once retries are exhausted")
    void shouldRecordBackendFailures() {
        factory.setFailure(new BackendException("service unavailable", 503));

        EvaluationResult result = factory.getEvaluator()
                .evaluate(factory.getPipeline(), dataset, Metrics.exactMatch(), factory.evaluationOptions())
                .join();

        assertThat(result.count()).isZero();
        assertThat(result.score()).isEqualTo(0.0);
        assertThat(result.errors()).hasSize(3)
                .allSatisfy(error -> assertThat(error.error()).isInstanceOf(BackendException.class));
        // Each example: one attempt plus two retries
        assertThat(factory.getStubBackend().getCalls()).isEqualTo(9);
    }

    @Test
    @DisplayName("should open the circuit after repeated exhausted retries")
    void shouldOpenCircuit() {
        factory.setFailure(new BackendException("service unavailable", 503));
        factory.getEvaluator()
                .evaluate(factory.getPipeline(), dataset, Metrics.exactMatch(), factory.evaluationOptions())
                .join();

        CompletableFuture<GenerationResult> rejected = factory.getBackend().generate("2+2");

        assertThatThrownBy(rejected::join).hasCauseInstanceOf(CircuitOpenException.class);
        assertThat(factory.getStubBackend().getCalls()).isEqualTo(9);
    }

    @Test
    @DisplayName("should optimize end to end and checkpoint each generation")
    void shouldOptimize() {
        factory.setAnswers(prompt -> prompt.contains("France") ? "Paris" : "4");
        OptimizerOptions options = factory.optimizerOptions().withRunId("integration-run");

        OptimizationResult result = factory.getOptimizer()
                .optimize(factory.getPipeline(), dataset, Metrics.exactMatch(), options)
                .join();
        factory.close();

        assertThat(result.bestScore()).isEqualTo(1.0);
        assertThat(result.totalIterations()).isEqualTo(2);
        assertThat(result.history()).hasSize(3);
        assertThat(result.converged()).isTrue();
        assertThat(factory.getStorage().loadHistory("integration-run")).hasSize(2);
    }
}
