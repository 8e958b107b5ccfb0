package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.domain.backend.BackendException;
import fr.lapetina.llm.tuner.domain.backend.StubBackend;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingBackendTest {

    private static final RetryOptions FAST = RetryOptions.defaults()
            .withDelays(5, 50)
            .withJitter(false);

    @Test
    @DisplayName("should retry transient failures until success")
    void shouldRetryUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();
        StubBackend stub = new StubBackend(prompt -> attempts.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(new BackendException("unavailable", 503))
                : CompletableFuture.completedFuture(GenerationResult.of("ok", "stub", GenerationResult.Usage.EMPTY)));

        GenerationResult result = new RetryingBackend(stub, FAST).generate("q").join();

        assertThat(result.text()).isEqualTo("ok");
        assertThat(stub.getCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("should call the backend at most maxRetries + 1 times")
    void shouldBoundAttempts() {
        StubBackend stub = StubBackend.failing(new BackendException("rate limited", 429));
        List<Long> delays = new CopyOnWriteArrayList<>();

        CompletableFuture<GenerationResult> call = new RetryingBackend(stub, FAST.withMaxRetries(2),
                (attempt, delayMs, error) -> delays.add(delayMs)).generate("q");

        assertThatThrownBy(call::join).hasCauseInstanceOf(BackendException.class);
        assertThat(stub.getCalls()).isEqualTo(3);
        assertThat(delays).containsExactly(5L, 10L);
    }

    @Test
    @DisplayName("should wait at least the backoff delay between attempts")
    void shouldWaitBetweenAttempts() {
        StubBackend stub = StubBackend.failing(new BackendException("unavailable", 503));

        CompletableFuture<GenerationResult> call =
                new RetryingBackend(stub, FAST.withDelays(40, 1000).withMaxRetries(1)).generate("q");

        assertThatThrownBy(call::join).hasCauseInstanceOf(BackendException.class);
        List<Long> times = stub.getCallTimes();
        assertThat(times).hasSize(2);
        assertThat(times.get(1) - times.get(0)).isGreaterThanOrEqualTo(35);
    }

    @Test
    @DisplayName("should not retry non-retryable failures")
    void shouldNotRetryClientErrors() {
        StubBackend stub = StubBackend.failing(new BackendException("bad request", 400));

        CompletableFuture<GenerationResult> call = new RetryingBackend(stub, FAST).generate("q");

        assertThatThrownBy(call::join)
                .hasCauseInstanceOf(BackendException.class)
                .hasMessageContaining("bad request");
        assertThat(stub.getCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("should honour a custom retryable predicate")
    void shouldHonourCustomPredicate() {
        StubBackend stub = StubBackend.failing(new IllegalStateException("anything"));

        CompletableFuture<GenerationResult> call = new RetryingBackend(stub,
                FAST.withMaxRetries(1).withRetryable(error -> true)).generate("q");

        assertThatThrownBy(call::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(stub.getCalls()).isEqualTo(2);
    }
}
