package fr.lapetina.llm.tuner.integration;

import fr.lapetina.llm.tuner.TunerFactory;
import fr.lapetina.llm.tuner.domain.backend.StubBackend;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Test extension of TunerFactory that puts a scriptable backend under the configured middleware.
 */
public final class TestTunerFactory extends TunerFactory {

    private final StubBackend stubBackend;

    private TestTunerFactory(String configPath, StubBackend stubBackend) {
        super(configPath, stubBackend);
        this.stubBackend = stubBackend;
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestTunerFactory create() {
        return create("test-config.yaml");
    }

    public static TestTunerFactory create(String configPath) {
        return new TestTunerFactory(configPath, new StubBackend());
    }

    /**
     * Answers every prompt with the same text.
     */
    public void setAnswer(String text) {
        stubBackend.setHandler(prompt -> CompletableFuture.completedFuture(
                GenerationResult.of(text, "stub", GenerationResult.Usage.EMPTY)));
    }

    /**
     * Answers each prompt with a computed text.
     */
    public void setAnswers(Function<String, String> answers) {
        stubBackend.setHandler(prompt -> CompletableFuture.completedFuture(
                GenerationResult.of(answers.apply(prompt), "stub", GenerationResult.Usage.EMPTY)));
    }

    /**
     * Fails every call with the given error.
     */
    public void setFailure(RuntimeException error) {
        stubBackend.setHandler(prompt -> CompletableFuture.failedFuture(error));
    }

    /**
     * Never answers.
     */
    public void setHanging() {
        stubBackend.setHandler(prompt -> new CompletableFuture<>());
    }

    public StubBackend getStubBackend() {
        return stubBackend;
    }
}
