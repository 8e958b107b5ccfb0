package fr.lapetina.llm.tuner.middleware;

/**
 * Timeout settings.
 */
public record TimeoutOptions(long timeoutMs) {

    public TimeoutOptions {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
    }

    public static TimeoutOptions defaults() {
        return new TimeoutOptions(30_000);
    }
}
