package fr.lapetina.llm.tuner.middleware;

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

/**
 * Races each call against a timer.
 *
 * When the timer wins the returned future completes normally with a TIMEOUT result
 * ({@link GenerationResult#timedOut()}, {@link EmbeddingResult#timedOut()}, or an empty
 * optional for streams). The inner call is not cancelled and its late result is dropped.
 * Failures of the inner call that happen before the timer fires propagate unchanged.
 */
public final class TimeoutBackend implements LlmBackend {

    private static final Logger log = LoggerFactory.getLogger(TimeoutBackend.class);

    private final LlmBackend delegate;
    private final long timeoutMs;

    public TimeoutBackend(LlmBackend delegate, TimeoutOptions options) {
        this.delegate = delegate;
        this.timeoutMs = options.timeoutMs();
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        return Futures.withTimeout(delegate.generate(prompt, options), timeoutMs)
                .thenApply(outcome -> {
                    if (outcome.isTimeout()) {
                        log.warn("Backend call timed out: operation=generate, timeoutMs={}", timeoutMs);
                        return GenerationResult.timedOut();
                    }
                    return outcome.get();
                });
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        return Futures.withTimeout(delegate.embed(text, options), timeoutMs)
                .thenApply(outcome -> {
                    if (outcome.isTimeout()) {
                        log.warn("Backend call timed out: operation=embed, timeoutMs={}", timeoutMs);
                        return EmbeddingResult.timedOut();
                    }
                    return outcome.get();
                });
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        return Futures.withTimeout(delegate.stream(prompt, options), timeoutMs)
                .thenApply(outcome -> {
                    if (outcome.isTimeout()) {
                        log.warn("Backend call timed out: operation=stream, timeoutMs={}", timeoutMs);
                        return Optional.<Flow.Publisher<String>>empty();
                    }
                    return outcome.get();
                });
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
