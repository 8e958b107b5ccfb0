package fr.lapetina.llm.tuner.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FuturesTest {

    private static final List<Integer> ONE_TO_NINE =
            IntStream.rangeClosed(1, 9).boxed().collect(Collectors.toList());

    private static <T> CompletableFuture<T> after(long delayMs, T value) {
        return Futures.delay(delayMs).thenApply(ignored -> value);
    }

    /**
     * Tracks the peak number of operations in flight.
     */
    private static final class ConcurrencyProbe {
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger peak = new AtomicInteger();

        <T> Function<T, CompletableFuture<T>> wrap(long delayMs) {
            return item -> {
                int current = inFlight.incrementAndGet();
                peak.accumulateAndGet(current, Math::max);
                return after(delayMs, item).whenComplete((v, e) -> inFlight.decrementAndGet());
            };
        }

        int peak() {
            return peak.get();
        }
    }

    @Nested
    @DisplayName("parallelMap")
    class ParallelMap {

        @Test
        @DisplayName("should preserve input order whatever the completion order")
        void shouldPreserveOrder() {
            List<Integer> result = Futures.parallelMap(3,
                    (Integer i) -> after((10 - i) * 5L, i * 10),
                    ONE_TO_NINE).join();

            assertThat(result).containsExactly(10, 20, 30, 40, 50, 60, 70, 80, 90);
        }

        @Test
        @DisplayName("should never exceed the concurrency bound")
        void shouldRespectBound() {
            ConcurrencyProbe probe = new ConcurrencyProbe();

            Futures.parallelMap(3, probe.<Integer>wrap(20), ONE_TO_NINE).join();

            assertThat(probe.peak()).isLessThanOrEqualTo(3);
        }

        @Test
        @DisplayName("should return an empty list for empty input")
        void shouldHandleEmptyInput() {
            List<Integer> result = Futures.parallelMap(3, (Integer i) -> after(1, i), List.<Integer>of()).join();

            assertThat(result).isEmpty();
        }

        @Test
        @DisplayName("should fail fast and skip later chunks")
        void shouldFailFast() {
            AtomicInteger started = new AtomicInteger();

            CompletableFuture<List<Integer>> result = Futures.parallelMap(2, (Integer i) -> {
                started.incrementAndGet();
                if (i == 2) {
                    return CompletableFuture.<Integer>failedFuture(new IllegalStateException("boom"));
                }
                return after(5, i);
            }, ONE_TO_NINE);

            assertThatThrownBy(result::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(started.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should turn a synchronous throw into a failed result")
        void shouldCaptureSynchronousThrow() {
            CompletableFuture<List<Integer>> result = Futures.parallelMap(2, (Integer i) -> {
                throw new IllegalArgumentException("sync");
            }, List.of(1));

            assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject a non-positive bound")
        void shouldRejectZeroBound() {
            assertThatThrownBy(() -> Futures.parallelMap(0, (Integer i) -> after(1, i), ONE_TO_NINE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("parallelMapUnordered")
    class ParallelMapUnordered {

        @Test
        @DisplayName("should return every result within the bound")
        void shouldReturnAllResults() {
            ConcurrencyProbe probe = new ConcurrencyProbe();

            List<Integer> result = Futures.parallelMapUnordered(3, probe.<Integer>wrap(5), ONE_TO_NINE).join();

            assertThat(result).containsExactlyInAnyOrderElementsOf(ONE_TO_NINE);
            assertThat(probe.peak()).isLessThanOrEqualTo(3);
        }
    }

    @Nested
    @DisplayName("boundedParallel")
    class BoundedParallel {

        @Test
        @DisplayName("should keep submission order and respect the bound")
        void shouldKeepOrder() {
            ConcurrencyProbe probe = new ConcurrencyProbe();

            List<Integer> result = Futures.boundedParallel(2, probe.<Integer>wrap(5), ONE_TO_NINE).join();

            assertThat(result).containsExactlyElementsOf(ONE_TO_NINE);
            assertThat(probe.peak()).isLessThanOrEqualTo(2);
        }
    }

    @Nested
    @DisplayName("withTimeout")
    class WithTimeout {

        @Test
        @DisplayName("should return OK when the source wins")
        void shouldReturnOk() {
            Outcome<String> outcome = Futures.withTimeout(after(5, "done"), 1000).join();

            assertThat(outcome.isOk()).isTrue();
            assertThat(outcome.get()).isEqualTo("done");
        }

        @Test
        @DisplayName("should return TIMEOUT without cancelling the source")
        void shouldReturnTimeout() {
            CompletableFuture<String> source = new CompletableFuture<>();

            Outcome<String> outcome = Futures.withTimeout(source, 20).join();

            assertThat(outcome.isTimeout()).isTrue();
            assertThat(outcome.orElse("fallback")).isEqualTo("fallback");
            assertThat(source.isCancelled()).isFalse();
        }

        @Test
        @DisplayName("should propagate a failure that happens first")
        void shouldPropagateFailure() {
            CompletableFuture<Outcome<String>> outcome =
                    Futures.withTimeout(CompletableFuture.failedFuture(new IOException("io")), 1000);

            assertThatThrownBy(outcome::join).hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should time out immediately for a past deadline")
        void shouldTimeOutPastDeadline() {
            CompletableFuture<Outcome<String>> outcome = Futures.withDeadline(
                    new CompletableFuture<>(), System.currentTimeMillis() - 1000);

            assertThat(outcome).isDone();
            assertThat(outcome.join().isTimeout()).isTrue();
        }
    }

    @Nested
    @DisplayName("retry")
    class Retry {

        private final Backoff fast = new Backoff(1, 5, 2.0, false);

        @Test
        @DisplayName("should succeed after transient failures")
        void shouldSucceedAfterFailures() {
            AtomicInteger calls = new AtomicInteger();

            String result = Futures.retry(() -> calls.incrementAndGet() < 3
                            ? CompletableFuture.<String>failedFuture(new IOException("flaky"))
                            : CompletableFuture.completedFuture("ok"),
                    3, fast, error -> true, (attempt, delayMs, error) -> { }).join();

            assertThat(result).isEqualTo("ok");
            assertThat(calls.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("should invoke at most maxRetries + 1 times")
        void shouldBoundInvocations() {
            AtomicInteger calls = new AtomicInteger();
            AtomicInteger notified = new AtomicInteger();

            CompletableFuture<String> result = Futures.retry(() -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IOException("down"));
            }, 2, fast, error -> true, (attempt, delayMs, error) -> notified.incrementAndGet());

            assertThatThrownBy(result::join).hasCauseInstanceOf(IOException.class);
            assertThat(calls.get()).isEqualTo(3);
            assertThat(notified.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should not retry a non-retryable error")
        void shouldNotRetryNonRetryable() {
            AtomicInteger calls = new AtomicInteger();

            CompletableFuture<String> result = Futures.retryWithBackoff(() -> {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalArgumentException("bad"));
            }, 5, 1, 2.0, 5, error -> !(error instanceof IllegalArgumentException));

            assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
            assertThat(calls.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("withResource")
    class WithResource {

        @Test
        @DisplayName("should release the resource once on success")
        void shouldReleaseOnSuccess() {
            AtomicInteger released = new AtomicInteger();

            String result = Futures.withResource("res",
                    r -> after(1, r + "-used"),
                    r -> released.incrementAndGet()).join();

            assertThat(result).isEqualTo("res-used");
            assertThat(released.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should release the resource once and keep the original error")
        void shouldReleaseOnFailure() {
            AtomicInteger released = new AtomicInteger();

            CompletableFuture<String> result = Futures.withResource("res",
                    r -> CompletableFuture.failedFuture(new IllegalStateException("op failed")),
                    r -> {
                        released.incrementAndGet();
                        throw new RuntimeException("cleanup failed");
                    });

            assertThatThrownBy(result::join)
                    .hasCauseInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("op failed");
            assertThat(released.get()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should measure elapsed time")
    void shouldMeasureElapsedTime() {
        Timed<String> timed = Futures.timed(after(30, "x")).join();

        assertThat(timed.result()).isEqualTo("x");
        assertThat(timed.elapsedMs()).isGreaterThanOrEqualTo(25);
    }

    @Test
    @DisplayName("should process items in batches")
    void shouldProcessBatches() {
        List<Integer> sums = Futures.<Integer, Integer>processBatches(4, 2,
                batch -> CompletableFuture.completedFuture(batch.stream().mapToInt(Integer::intValue).sum()),
                ONE_TO_NINE).join();

        assertThat(sums).containsExactly(10, 26, 9);
    }

    @Test
    @DisplayName("should delay without blocking the caller")
    void shouldDelay() throws Exception {
        long start = System.currentTimeMillis();
        CompletableFuture<Void> delay = Futures.delay(30);

        assertThat(delay.isDone()).isFalse();
        delay.get(1, TimeUnit.SECONDS);
        assertThat(System.currentTimeMillis() - start).isGreaterThanOrEqualTo(25);
    }

    @Test
    @DisplayName("should strip completion wrappers")
    void shouldUnwrap() {
        IOException root = new IOException("root");

        assertThat(Futures.unwrap(new CompletionException(new CompletionException(root)))).isSameAs(root);
    }
}
