package fr.lapetina.llm.tuner.domain.backend;

import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * Capability every LLM provider implementation must satisfy.
 *
 * All operations are asynchronous. Implementations must be thread-safe: the
 * evaluation engine and optimizer call them from many futures concurrently.
 * Middleware decorate a backend by composition and implement this same interface.
 */
public interface LlmBackend {

    /**
     * Generates a text completion.
     *
     * @param prompt  Prompt text
     * @param options Generation options (temperature, max-tokens, model, ...)
     * @return Future completed with the result, or failed with the backend error
     */
    CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options);

    /**
     * Computes an embedding vector for the text.
     */
    CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options);

    /**
     * Streams a generation as text fragments.
     *
     * @return Future of a publisher, or of an empty optional when streaming is not supported
     */
    CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options);

    default CompletableFuture<GenerationResult> generate(String prompt) {
        return generate(prompt, Map.of());
    }

    default CompletableFuture<EmbeddingResult> embed(String text) {
        return embed(text, Map.of());
    }
}
