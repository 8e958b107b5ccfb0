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
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Logs calls, results and errors. Values and errors pass through untouched.
 */
public final class LoggingBackend implements LlmBackend {

    private static final Logger log = LoggerFactory.getLogger(LoggingBackend.class);

    private static final int MAX_LOGGED_CHARS = 200;

    private final LlmBackend delegate;
    private final LoggingOptions options;

    public LoggingBackend(LlmBackend delegate, LoggingOptions options) {
        this.delegate = delegate;
        this.options = options;
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        return execute("generate", prompt, () -> delegate.generate(prompt, options),
                result -> "status=" + result.status() + ", tokens=" + result.usage().totalTokens()
                        + ", text=" + abbreviate(result.text()));
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        return execute("embed", text, () -> delegate.embed(text, options),
                result -> "status=" + result.status() + ", dimensions=" + result.dimensions());
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        return execute("stream", prompt, () -> delegate.stream(prompt, options),
                result -> "supported=" + result.isPresent());
    }

    private <T> CompletableFuture<T> execute(
            String operation,
            String input,
            Supplier<CompletableFuture<T>> call,
            Function<T, String> describe
    ) {
        long start = System.currentTimeMillis();
        if (options.logRequests()) {
            log.info("Backend call started: operation={}, input={}", operation, abbreviate(input));
        }
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> {
            long elapsed = System.currentTimeMillis() - start;
            if (error != null) {
                if (options.logErrors()) {
                    Throwable cause = Futures.unwrap(error);
                    log.error("Backend call failed: operation={}, elapsedMs={}, error={}",
                            operation, elapsed, cause.getMessage(), cause);
                }
            } else if (options.logResponses()) {
                log.info("Backend call completed: operation={}, elapsedMs={}, {}",
                        operation, elapsed, describe.apply(result));
            } else {
                log.debug("Backend call completed: operation={}, elapsedMs={}", operation, elapsed);
            }
        });
    }

    static String abbreviate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_LOGGED_CHARS ? text : text.substring(0, MAX_LOGGED_CHARS) + "...";
    }
}
