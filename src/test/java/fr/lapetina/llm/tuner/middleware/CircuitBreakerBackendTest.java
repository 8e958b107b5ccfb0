package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.domain.backend.StubBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerBackendTest {

    @Test
    @DisplayName("should reject calls without reaching the backend while open")
    void shouldRejectWhileOpen() {
        AtomicLong clock = new AtomicLong(0);
        StubBackend stub = StubBackend.failing(new IllegalStateException("down"));
        CircuitBreaker breaker = new CircuitBreaker("backend", new CircuitBreakerOptions(2, 1000, 1), clock::get);
        CircuitBreakerBackend backend = new CircuitBreakerBackend(stub, breaker);

        for (int i = 0; i < 2; i++) {
            CompletableFuture<?> call = backend.generate("q");
            assertThatThrownBy(call::join).hasCauseInstanceOf(IllegalStateException.class);
        }
        CompletableFuture<?> rejected = backend.generate("q");

        assertThatThrownBy(rejected::join).hasCauseInstanceOf(CircuitOpenException.class);
        assertThat(stub.getCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("should close again after a successful probe")
    void shouldRecoverAfterProbe() {
        AtomicLong clock = new AtomicLong(0);
        StubBackend stub = StubBackend.failing(new IllegalStateException("down"));
        CircuitBreaker breaker = new CircuitBreaker("backend", new CircuitBreakerOptions(1, 1000, 1), clock::get);
        CircuitBreakerBackend backend = new CircuitBreakerBackend(stub, breaker);

        CompletableFuture<?> failed = backend.generate("q");
        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        clock.addAndGet(1001);
        stub.setHandler(prompt -> StubBackend.answering("ok").generate(prompt));

        assertThat(backend.generate("q").join().text()).isEqualTo("ok");
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should share one breaker across operations")
    void shouldShareBreaker() {
        StubBackend stub = StubBackend.failing(new IllegalStateException("down"));
        CircuitBreakerBackend backend = new CircuitBreakerBackend(stub, new CircuitBreakerOptions(1, 60_000, 1));

        CompletableFuture<?> failed = backend.generate("q");
        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);

        CompletableFuture<?> embed = backend.embed("text");
        assertThatThrownBy(embed::join).hasCauseInstanceOf(CircuitOpenException.class);
    }
}
