package fr.lapetina.llm.tuner.domain.backend;

import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.assertThat;

class EchoBackendTest {

    @Test
    @DisplayName("should echo the prompt when no response is configured")
    void shouldEchoPrompt() {
        GenerationResult result = new EchoBackend().generate("hello there").join();

        assertThat(result.text()).isEqualTo("hello there");
        assertThat(result.isOk()).isTrue();
        assertThat(result.model()).isEqualTo("echo-1");
        assertThat(result.usage().totalTokens()).isEqualTo(4);
    }

    @Test
    @DisplayName("should return the configured response and honour the model option")
    void shouldReturnConfiguredResponse() {
        EchoBackend backend = new EchoBackend(Map.of("response", "42", "model", "m-a"));

        assertThat(backend.generate("q", Map.of()).join().text()).isEqualTo("42");
        assertThat(backend.generate("q", Map.of("model", "m-b")).join().model()).isEqualTo("m-b");
    }

    @Test
    @DisplayName("should compute deterministic embeddings")
    void shouldComputeDeterministicEmbeddings() {
        EchoBackend backend = new EchoBackend(Map.of("dimensions", 4));

        EmbeddingResult first = backend.embed("text").join();
        EmbeddingResult second = backend.embed("text").join();

        assertThat(first.dimensions()).isEqualTo(4);
        assertThat(first.vector()).isEqualTo(second.vector());
    }

    @Test
    @DisplayName("should stream whitespace separated tokens")
    void shouldStreamTokens() {
        Optional<Flow.Publisher<String>> publisher = new EchoBackend().stream("a b c", Map.of()).join();
        assertThat(publisher).isPresent();

        List<String> received = new ArrayList<>();
        boolean[] completed = {false};
        publisher.get().subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(String item) {
                received.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
            }

            @Override
            public void onComplete() {
                completed[0] = true;
            }
        });

        assertThat(received).containsExactly("a", "b", "c");
        assertThat(completed[0]).isTrue();
    }
}
