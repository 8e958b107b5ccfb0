package fr.lapetina.llm.tuner.evaluate;

/**
 * Evaluation settings.
 *
 * @param parallel       Run examples concurrently instead of one after the other
 * @param maxConcurrency Examples in flight in parallel mode
 * @param timeoutMs      Per-example timeout
 */
public record EvaluationOptions(boolean parallel, int maxConcurrency, long timeoutMs) {

    public EvaluationOptions {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
    }

    public static EvaluationOptions defaults() {
        return new EvaluationOptions(false, 4, 30_000);
    }

    public static EvaluationOptions parallel(int maxConcurrency) {
        return new EvaluationOptions(true, maxConcurrency, 30_000);
    }

    public EvaluationOptions withTimeoutMs(long timeoutMs) {
        return new EvaluationOptions(parallel, maxConcurrency, timeoutMs);
    }
}
