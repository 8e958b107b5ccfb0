package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.concurrent.TokenBucket;
import fr.lapetina.llm.tuner.domain.backend.LlmBackend;
import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * Spaces call starts at least {@code 1000 / rps} ms apart.
 * All three operations share one bucket.
 */
public final class ThrottledBackend implements LlmBackend {

    private final LlmBackend delegate;
    private final TokenBucket bucket;

    public ThrottledBackend(LlmBackend delegate, TokenBucket bucket) {
        this.delegate = delegate;
        this.bucket = bucket;
    }

    public ThrottledBackend(LlmBackend delegate, ThrottleOptions options) {
        this(delegate, new TokenBucket(options.rps(), options.burst()));
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        return bucket.acquire().thenCompose(ignored -> delegate.generate(prompt, options));
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        return bucket.acquire().thenCompose(ignored -> delegate.embed(text, options));
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        return bucket.acquire().thenCompose(ignored -> delegate.stream(prompt, options));
    }

    public TokenBucket getBucket() {
        return bucket;
    }
}
