package fr.lapetina.llm.tuner.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * CompletableFuture helpers for bounded parallelism, timeouts, retries and cleanup.
 *
 * Timer waits are scheduled on {@link CompletableFuture#delayedExecutor}; no helper
 * blocks a thread while waiting, except {@link #boundedParallel} which parks its own
 * worker threads on a semaphore.
 */
public final class Futures {

    private static final Logger log = LoggerFactory.getLogger(Futures.class);

    private static final int MAX_PARALLELISM = 16;

    /**
     * Default parallelism, from the LLM_TUNER_PARALLELISM environment variable
     * (default 8), capped at 16.
     */
    public static final int DEFAULT_PARALLELISM = resolveDefaultParallelism();

    private Futures() {
        // Utility class
    }

    private static int resolveDefaultParallelism() {
        String env = System.getenv("LLM_TUNER_PARALLELISM");
        int value = 8;
        if (env != null && !env.isBlank()) {
            try {
                value = Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid LLM_TUNER_PARALLELISM, using default: value={}", env);
            }
        }
        return Math.max(1, Math.min(MAX_PARALLELISM, value));
    }

    /**
     * Returns a future completing after the delay, without holding a thread.
     */
    public static CompletableFuture<Void> delay(long delayMs) {
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS));
    }

    /**
     * Maps {@code f} over the items with at most {@code n} operations in flight.
     *
     * Items are processed in chunks of {@code n}: a chunk starts only when the previous one
     * has fully completed. The output list matches the input order whatever the completion
     * order. The first failure fails the whole result and later chunks are never started;
     * results of completed chunks are discarded.
     */
    public static <T, R> CompletableFuture<List<R>> parallelMap(
            int n,
            Function<? super T, CompletableFuture<R>> f,
            List<T> items
    ) {
        requirePositive(n);
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<R> results = Collections.synchronizedList(new ArrayList<>(items.size()));
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (List<T> chunk : partition(items, n)) {
            chain = chain.thenCompose(ignored -> runChunk(chunk, f).thenAccept(results::addAll));
        }

        return chain.thenApply(ignored -> Collections.unmodifiableList(new ArrayList<>(results)));
    }

    /**
     * {@link #parallelMap(int, Function, List)} with {@link #DEFAULT_PARALLELISM}.
     */
    public static <T, R> CompletableFuture<List<R>> parallelMap(
            Function<? super T, CompletableFuture<R>> f,
            List<T> items
    ) {
        return parallelMap(DEFAULT_PARALLELISM, f, items);
    }

    private static <T, R> CompletableFuture<List<R>> runChunk(
            List<T> chunk,
            Function<? super T, CompletableFuture<R>> f
    ) {
        List<CompletableFuture<R>> inFlight = new ArrayList<>(chunk.size());
        for (T item : chunk) {
            inFlight.add(invoke(f, item));
        }
        return allOrFirstFailure(inFlight);
    }

    /**
     * Collects the futures in order, failing as soon as any one fails.
     */
    static <R> CompletableFuture<List<R>> allOrFirstFailure(List<CompletableFuture<R>> futures) {
        CompletableFuture<List<R>> result = new CompletableFuture<>();
        for (CompletableFuture<R> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                }
            });
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        result.completeExceptionally(unwrap(error));
                        return;
                    }
                    List<R> values = new ArrayList<>(futures.size());
                    for (CompletableFuture<R> future : futures) {
                        values.add(future.join());
                    }
                    result.complete(values);
                });
        return result;
    }

    /**
     * Same results as {@link #parallelMap(int, Function, List)}, in completion order.
     *
     * A new operation starts as soon as one finishes, so at most {@code n} are in flight
     * but there is no chunk barrier.
     */
    public static <T, R> CompletableFuture<List<R>> parallelMapUnordered(
            int n,
            Function<? super T, CompletableFuture<R>> f,
            List<T> items
    ) {
        requirePositive(n);
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        CompletableFuture<List<R>> result = new CompletableFuture<>();
        List<R> completed = Collections.synchronizedList(new ArrayList<>(items.size()));
        AtomicInteger cursor = new AtomicInteger();
        AtomicInteger remaining = new AtomicInteger(items.size());

        int initial = Math.min(n, items.size());
        for (int i = 0; i < initial; i++) {
            launchNext(items, f, cursor, remaining, completed, result);
        }
        return result;
    }

    private static <T, R> void launchNext(
            List<T> items,
            Function<? super T, CompletableFuture<R>> f,
            AtomicInteger cursor,
            AtomicInteger remaining,
            List<R> completed,
            CompletableFuture<List<R>> result
    ) {
        int index = cursor.getAndIncrement();
        if (index >= items.size() || result.isDone()) {
            return;
        }
        invoke(f, items.get(index)).whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            completed.add(value);
            if (remaining.decrementAndGet() == 0) {
                result.complete(Collections.unmodifiableList(new ArrayList<>(completed)));
            } else {
                launchNext(items, f, cursor, remaining, completed, result);
            }
        });
    }

    /**
     * Runs each item on the executor, gated by a counting semaphore.
     *
     * Unlike {@link #parallelMap(int, Function, List)} there is no chunk barrier: a permit
     * freed by any operation lets the next one start. The ceiling is
     * {@code min(maxConcurrent, DEFAULT_PARALLELISM)}. Results follow submission order.
     */
    public static <T, R> CompletableFuture<List<R>> boundedParallel(
            int maxConcurrent,
            Function<? super T, CompletableFuture<R>> f,
            List<T> items,
            ExecutorService executor
    ) {
        requirePositive(maxConcurrent);
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        Semaphore permits = new Semaphore(Math.min(maxConcurrent, DEFAULT_PARALLELISM));
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CompletionException(e);
                }
                try {
                    return invoke(f, item).join();
                } finally {
                    permits.release();
                }
            }, executor));
        }
        return allOrFirstFailure(futures);
    }

    /**
     * {@link #boundedParallel(int, Function, List, ExecutorService)} on a private pool that
     * is shut down once every item has completed.
     */
    public static <T, R> CompletableFuture<List<R>> boundedParallel(
            int maxConcurrent,
            Function<? super T, CompletableFuture<R>> f,
            List<T> items
    ) {
        int threads = Math.max(1, Math.min(maxConcurrent, DEFAULT_PARALLELISM));
        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "bounded-parallel-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return boundedParallel(maxConcurrent, f, items, executor)
                .whenComplete((ignored, error) -> executor.shutdown());
    }

    /**
     * Races the future against a timer.
     *
     * The returned future always completes normally with an OK or TIMEOUT outcome when
     * the source succeeds or the timer fires first; it fails only if the source fails
     * first. The source is not cancelled on timeout.
     */
    public static <T> CompletableFuture<Outcome<T>> withTimeout(CompletableFuture<T> future, long timeoutMs) {
        return future.<Outcome<T>>thenApply(Outcome::ok)
                .completeOnTimeout(Outcome.timeout(), Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
    }

    /**
     * Races the future against an absolute deadline (epoch milliseconds).
     * A deadline already in the past yields an immediate timeout.
     */
    public static <T> CompletableFuture<Outcome<T>> withDeadline(CompletableFuture<T> future, long deadlineEpochMs) {
        long remaining = deadlineEpochMs - System.currentTimeMillis();
        if (remaining <= 0) {
            return CompletableFuture.completedFuture(Outcome.timeout());
        }
        return withTimeout(future, remaining);
    }

    /**
     * Callback invoked before each scheduled retry.
     */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int attempt, long delayMs, Throwable error);
    }

    /**
     * Runs the operation, retrying retryable failures on the backoff schedule.
     *
     * The operation runs at most {@code maxRetries + 1} times. A non-retryable failure, or
     * the failure of the last allowed attempt, fails the returned future with that error.
     */
    public static <T> CompletableFuture<T> retry(
            Supplier<CompletableFuture<T>> operation,
            int maxRetries,
            Backoff backoff,
            Predicate<Throwable> retryable,
            RetryListener listener
    ) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        return attempt(operation, 0, maxRetries, backoff, retryable, listener);
    }

    private static <T> CompletableFuture<T> attempt(
            Supplier<CompletableFuture<T>> operation,
            int attempt,
            int maxRetries,
            Backoff backoff,
            Predicate<Throwable> retryable,
            RetryListener listener
    ) {
        return invoke(ignored -> operation.get(), null)
                .handle((value, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(value);
                    }
                    Throwable cause = unwrap(error);
                    if (attempt < maxRetries && retryable.test(cause)) {
                        long delayMs = backoff.delayMillis(attempt);
                        listener.onRetry(attempt + 1, delayMs, cause);
                        return delay(delayMs).thenCompose(v ->
                                attempt(operation, attempt + 1, maxRetries, backoff, retryable, listener));
                    }
                    return CompletableFuture.<T>failedFuture(cause);
                })
                .thenCompose(Function.identity());
    }

    /**
     * General-purpose retry with exponential backoff and no jitter.
     */
    public static <T> CompletableFuture<T> retryWithBackoff(
            Supplier<CompletableFuture<T>> operation,
            int maxRetries,
            long initialDelayMs,
            double backoffFactor,
            long maxDelayMs,
            Predicate<Throwable> retryable
    ) {
        Backoff backoff = new Backoff(initialDelayMs, maxDelayMs, backoffFactor, false);
        return retry(operation, maxRetries, backoff, retryable,
                (attempt, delayMs, error) -> log.debug("Retrying operation: retry={}, delayMs={}, error={}",
                        attempt, delayMs, error.getMessage()));
    }

    /**
     * Retries every failure, factor 2.0, delay capped at 30s.
     */
    public static <T> CompletableFuture<T> retryWithBackoff(
            Supplier<CompletableFuture<T>> operation,
            int maxRetries,
            long initialDelayMs
    ) {
        return retryWithBackoff(operation, maxRetries, initialDelayMs, 2.0, 30_000, error -> true);
    }

    /**
     * Runs an operation on a resource and releases it exactly once.
     *
     * Cleanup runs on both the success and the failure path. An exception thrown by
     * cleanup is logged and never replaces the operation's result or error.
     */
    public static <R, T> CompletableFuture<T> withResource(
            R resource,
            Function<? super R, CompletableFuture<T>> operation,
            Consumer<? super R> cleanup
    ) {
        return invoke(operation, resource).handle((value, error) -> {
            try {
                cleanup.accept(resource);
            } catch (RuntimeException e) {
                if (error != null) {
                    log.warn("Error during resource cleanup after failure: error={}", e.getMessage(), e);
                } else {
                    log.warn("Error during resource cleanup: error={}", e.getMessage(), e);
                }
            }
            if (error != null) {
                throw new CompletionException(unwrap(error));
            }
            return value;
        });
    }

    /**
     * Pairs the future's result with the time elapsed from this call to its completion.
     */
    public static <T> CompletableFuture<Timed<T>> timed(CompletableFuture<T> future) {
        long start = System.currentTimeMillis();
        return future.thenApply(result -> new Timed<>(result, System.currentTimeMillis() - start));
    }

    /**
     * Splits the items into batches and processes up to {@code concurrency} batches at once.
     */
    public static <T, R> CompletableFuture<List<R>> processBatches(
            int batchSize,
            int concurrency,
            Function<List<T>, CompletableFuture<R>> batchFn,
            List<T> items
    ) {
        requirePositive(batchSize);
        return parallelMap(concurrency, batchFn, partition(items, batchSize));
    }

    /**
     * Parallel map bounded both in concurrency and in starts per second.
     */
    public static <T, R> CompletableFuture<List<R>> rateLimitedParallelMap(
            int concurrency,
            double rps,
            Function<? super T, CompletableFuture<R>> f,
            List<T> items
    ) {
        TokenBucket bucket = new TokenBucket(rps, 1);
        return parallelMap(concurrency,
                item -> bucket.acquire().thenCompose(ignored -> f.apply(item)),
                items);
    }

    /**
     * Strips CompletionException / ExecutionException wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Applies {@code f}, turning a synchronous throw or a null future into a failed future.
     */
    static <T, R> CompletableFuture<R> invoke(Function<? super T, CompletableFuture<R>> f, T item) {
        try {
            CompletableFuture<R> future = f.apply(item);
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Operation returned a null future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(List.copyOf(items.subList(from, Math.min(items.size(), from + size))));
        }
        return chunks;
    }

    private static void requirePositive(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Concurrency must be >= 1: " + n);
        }
    }
}
