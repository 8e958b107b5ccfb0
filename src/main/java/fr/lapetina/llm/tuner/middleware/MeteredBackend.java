package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.concurrent.Futures;
import fr.lapetina.llm.tuner.domain.backend.BackendException;
import fr.lapetina.llm.tuner.domain.backend.LlmBackend;
import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.ErrorType;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import fr.lapetina.llm.tuner.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Records call counts, latencies and error types in the metrics registry.
 */
public final class MeteredBackend implements LlmBackend {

    private final LlmBackend delegate;
    private final MetricsRegistry metrics;

    public MeteredBackend(LlmBackend delegate, MetricsRegistry metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        return execute("generate", () -> delegate.generate(prompt, options), GenerationResult::isTimeout);
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        return execute("embed", () -> delegate.embed(text, options), EmbeddingResult::isTimeout);
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        return execute("stream", () -> delegate.stream(prompt, options), Optional::isEmpty);
    }

    private <T> CompletableFuture<T> execute(
            String operation,
            Supplier<CompletableFuture<T>> call,
            Predicate<T> timedOut
    ) {
        long start = System.nanoTime();
        metrics.callStarted();
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> {
            metrics.callFinished();
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            if (error != null) {
                metrics.recordBackendCall(operation, "error", latency);
                ErrorType type = classify(Futures.unwrap(error));
                metrics.incrementErrorCount(operation, type);
                if (type == ErrorType.CIRCUIT_OPEN) {
                    metrics.incrementCircuitRejections();
                }
            } else if (timedOut.test(result)) {
                metrics.recordBackendCall(operation, "timeout", latency);
                metrics.incrementErrorCount(operation, ErrorType.TIMEOUT);
            } else {
                metrics.recordBackendCall(operation, "ok", latency);
            }
        });
    }

    static ErrorType classify(Throwable error) {
        if (error instanceof CircuitOpenException open) {
            return open.getErrorType();
        }
        if (error instanceof BackendException backendError) {
            return backendError.getErrorType();
        }
        return DefaultRetryableErrors.INSTANCE.test(error) ? ErrorType.TRANSIENT : ErrorType.INTERNAL_ERROR;
    }
}
