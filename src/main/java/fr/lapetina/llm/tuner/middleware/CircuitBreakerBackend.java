package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.domain.backend.LlmBackend;
import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Supplier;

/**
 * Fails fast with {@link CircuitOpenException} while the breaker is open.
 * One breaker is shared by the three operations.
 */
public final class CircuitBreakerBackend implements LlmBackend {

    private final LlmBackend delegate;
    private final CircuitBreaker breaker;

    public CircuitBreakerBackend(LlmBackend delegate, CircuitBreaker breaker) {
        this.delegate = delegate;
        this.breaker = breaker;
    }

    public CircuitBreakerBackend(LlmBackend delegate, CircuitBreakerOptions options) {
        this(delegate, new CircuitBreaker("backend", options));
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        return execute(() -> delegate.generate(prompt, options));
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        return execute(() -> delegate.embed(text, options));
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        return execute(() -> delegate.stream(prompt, options));
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    private <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> call) {
        if (!breaker.allowRequest()) {
            return CompletableFuture.failedFuture(new CircuitOpenException(breaker.getName(), breaker.snapshot()));
        }
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            breaker.recordFailure();
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> {
            if (error != null) {
                breaker.recordFailure();
            } else {
                breaker.recordSuccess();
            }
        });
    }
}
