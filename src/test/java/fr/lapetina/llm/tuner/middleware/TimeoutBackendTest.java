package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.concurrent.Futures;
import fr.lapetina.llm.tuner.domain.backend.StubBackend;
import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import fr.lapetina.llm.tuner.domain.model.ResultStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeoutBackendTest {

    @Test
    @DisplayName("should pass through results that arrive in time")
    void shouldPassThrough() {
        TimeoutBackend backend = new TimeoutBackend(StubBackend.answering("fast"), new TimeoutOptions(1000));

        GenerationResult result = backend.generate("q").join();

        assertThat(result.text()).isEqualTo("fast");
        assertThat(result.isOk()).isTrue();
    }

    @Test
    @DisplayName("should complete with a TIMEOUT result when the backend is too slow")
    void shouldReturnTimeoutResult() {
        StubBackend slow = new StubBackend(prompt -> Futures.delay(500)
                .thenApply(ignored -> GenerationResult.of("late", "stub", GenerationResult.Usage.EMPTY)));
        TimeoutBackend backend = new TimeoutBackend(slow, new TimeoutOptions(30));

        GenerationResult result = backend.generate("q").join();

        assertThat(result.isTimeout()).isTrue();
        assertThat(result.status()).isEqualTo(ResultStatus.TIMEOUT);
    }

    @Test
    @DisplayName("should time out embeddings and streams")
    void shouldTimeOutOtherOperations() {
        TimeoutBackend backend = new TimeoutBackend(StubBackend.hanging(), new TimeoutOptions(20));

        EmbeddingResult embedding = backend.embed("text").join();

        assertThat(embedding.isTimeout()).isTrue();
        assertThat(backend.stream("q", Map.of()).join()).isEmpty();
    }

    @Test
    @DisplayName("should propagate failures that happen before the deadline")
    void shouldPropagateFailures() {
        TimeoutBackend backend = new TimeoutBackend(
                StubBackend.failing(new IllegalStateException("boom")), new TimeoutOptions(1000));

        CompletableFuture<GenerationResult> call = backend.generate("q");

        assertThatThrownBy(call::join).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should reject a non-positive timeout")
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> new TimeoutOptions(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
