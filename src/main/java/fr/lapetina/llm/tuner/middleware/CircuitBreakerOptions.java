package fr.lapetina.llm.tuner.middleware;

/**
 * Circuit breaker settings.
 *
 * @param failureThreshold Consecutive failures in CLOSED before opening
 * @param timeoutMs        Time since the last failure before a probe is let through
 * @param successThreshold Successes in HALF_OPEN before closing
 */
public record CircuitBreakerOptions(int failureThreshold, long timeoutMs, int successThreshold) {

    public CircuitBreakerOptions {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0: " + timeoutMs);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1: " + successThreshold);
        }
    }

    public static CircuitBreakerOptions defaults() {
        return new CircuitBreakerOptions(5, 60_000, 3);
    }
}
