package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.concurrent.Backoff;
import fr.lapetina.llm.tuner.concurrent.Futures;
import fr.lapetina.llm.tuner.domain.backend.LlmBackend;
import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Supplier;

/**
 * Retries retryable failures with exponential backoff.
 *
 * Non-retryable failures and the failure of the last allowed attempt propagate
 * unchanged. Waits between attempts run on a timer.
 */
public final class RetryingBackend implements LlmBackend {

    private static final Logger log = LoggerFactory.getLogger(RetryingBackend.class);

    private final LlmBackend delegate;
    private final RetryOptions options;
    private final Backoff backoff;
    private final Futures.RetryListener listener;

    public RetryingBackend(LlmBackend delegate, RetryOptions options, Futures.RetryListener listener) {
        this.delegate = delegate;
        this.options = options;
        this.backoff = options.backoff();
        this.listener = listener;
    }

    public RetryingBackend(LlmBackend delegate, RetryOptions options) {
        this(delegate, options, (attempt, delayMs, error) -> { });
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        return execute("generate", () -> delegate.generate(prompt, options));
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        return execute("embed", () -> delegate.embed(text, options));
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        return execute("stream", () -> delegate.stream(prompt, options));
    }

    private <T> CompletableFuture<T> execute(String operation, Supplier<CompletableFuture<T>> call) {
        return Futures.retry(call, options.maxRetries(), backoff, options.retryable(),
                (attempt, delayMs, error) -> {
                    log.warn("Retrying backend call: operation={}, retry={}/{}, delayMs={}, error={}",
                            operation, attempt, options.maxRetries(), delayMs, error.getMessage());
                    listener.onRetry(attempt, delayMs, error);
                });
    }
}
