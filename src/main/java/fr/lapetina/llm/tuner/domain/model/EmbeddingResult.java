package fr.lapetina.llm.tuner.domain.model;

import java.util.List;

/**
 * Result of an embedding call.
 * Immutable and thread-safe.
 */
public record EmbeddingResult(
        List<Double> vector,
        String model,
        int promptTokens,
        ResultStatus status
) {
    public EmbeddingResult {
        vector = vector != null ? List.copyOf(vector) : List.of();
        if (status == null) {
            status = ResultStatus.OK;
        }
    }

    public boolean isTimeout() {
        return status == ResultStatus.TIMEOUT;
    }

    public int dimensions() {
        return vector.size();
    }

    public static EmbeddingResult of(List<Double> vector, String model, int promptTokens) {
        return new EmbeddingResult(vector, model, promptTokens, ResultStatus.OK);
    }

    public static EmbeddingResult timedOut() {
        return new EmbeddingResult(List.of(), null, 0, ResultStatus.TIMEOUT);
    }
}
