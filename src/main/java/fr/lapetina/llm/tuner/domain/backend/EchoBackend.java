package fr.lapetina.llm.tuner.domain.backend;

import fr.lapetina.llm.tuner.domain.model.EmbeddingResult;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Offline backend that answers without any network call.
 *
 * Generation returns the configured {@code response} setting, or the prompt itself.
 * Embeddings are a deterministic function of the text. Useful for dry runs of an
 * optimization and for tests of the middleware stack.
 */
public final class EchoBackend implements LlmBackend {

    public static final String PROVIDER = "echo";

    private static final int DEFAULT_DIMENSIONS = 8;

    private final String model;
    private final String fixedResponse;
    private final int dimensions;

    public EchoBackend(Map<String, Object> settings) {
        Object model = settings.get("model");
        Object response = settings.get("response");
        Object dimensions = settings.get("dimensions");
        this.model = model != null ? model.toString() : "echo-1";
        this.fixedResponse = response != null ? response.toString() : null;
        this.dimensions = dimensions instanceof Number n ? n.intValue() : DEFAULT_DIMENSIONS;
    }

    public EchoBackend() {
        this(Map.of());
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, Map<String, Object> options) {
        String text = fixedResponse != null ? fixedResponse : prompt;
        GenerationResult result = GenerationResult.of(
                text,
                modelFor(options),
                GenerationResult.Usage.of(countWords(prompt), countWords(text))
        );
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<EmbeddingResult> embed(String text, Map<String, Object> options) {
        List<Double> vector = new ArrayList<>(dimensions);
        int seed = text.hashCode();
        for (int i = 0; i < dimensions; i++) {
            seed = seed * 31 + i;
            vector.add((seed % 1000) / 1000.0);
        }
        return CompletableFuture.completedFuture(
                EmbeddingResult.of(vector, modelFor(options), countWords(text)));
    }

    @Override
    public CompletableFuture<Optional<Flow.Publisher<String>>> stream(String prompt, Map<String, Object> options) {
        String text = fixedResponse != null ? fixedResponse : prompt;
        List<String> tokens = text.isBlank() ? List.of() : Arrays.asList(text.trim().split("\\s+"));
        return CompletableFuture.completedFuture(Optional.of(new TokenPublisher(tokens)));
    }

    private String modelFor(Map<String, Object> options) {
        Object requested = options.get("model");
        return requested != null ? requested.toString() : model;
    }

    private static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    /**
     * Emits a fixed token list honouring subscriber demand.
     */
    private static final class TokenPublisher implements Flow.Publisher<String> {

        private final List<String> tokens;

        TokenPublisher(List<String> tokens) {
            this.tokens = tokens;
        }

        @Override
        public void subscribe(Flow.Subscriber<? super String> subscriber) {
            AtomicInteger position = new AtomicInteger();
            AtomicBoolean done = new AtomicBoolean(false);
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    if (n <= 0) {
                        if (done.compareAndSet(false, true)) {
                            subscriber.onError(new IllegalArgumentException("Demand must be positive: " + n));
                        }
                        return;
                    }
                    for (long i = 0; i < n && !done.get(); i++) {
                        int index = position.getAndIncrement();
                        if (index >= tokens.size()) {
                            break;
                        }
                        subscriber.onNext(tokens.get(index));
                    }
                    if (position.get() >= tokens.size() && done.compareAndSet(false, true)) {
                        subscriber.onComplete();
                    }
                }

                @Override
                public void cancel() {
                    done.set(true);
                }
            });
        }
    }
}
