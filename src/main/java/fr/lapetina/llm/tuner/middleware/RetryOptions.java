package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.concurrent.Backoff;

import java.util.function.Predicate;

/**
 * Retry settings.
 *
 * @param maxRetries Retries after the first attempt; the backend is called at most {@code maxRetries + 1} times
 * @param retryable  Decides whether a failure is worth another attempt
 */
public record RetryOptions(
        int maxRetries,
        long initialDelayMs,
        long maxDelayMs,
        double backoffFactor,
        boolean jitter,
        Predicate<Throwable> retryable
) {
    public RetryOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (retryable == null) {
            retryable = DefaultRetryableErrors.INSTANCE;
        }
    }

    public static RetryOptions defaults() {
        return new RetryOptions(3, 1000, 30_000, 2.0, true, DefaultRetryableErrors.INSTANCE);
    }

    public RetryOptions withMaxRetries(int maxRetries) {
        return new RetryOptions(maxRetries, initialDelayMs, maxDelayMs, backoffFactor, jitter, retryable);
    }

    public RetryOptions withDelays(long initialDelayMs, long maxDelayMs) {
        return new RetryOptions(maxRetries, initialDelayMs, maxDelayMs, backoffFactor, jitter, retryable);
    }

    public RetryOptions withJitter(boolean jitter) {
        return new RetryOptions(maxRetries, initialDelayMs, maxDelayMs, backoffFactor, jitter, retryable);
    }

    public RetryOptions withRetryable(Predicate<Throwable> retryable) {
        return new RetryOptions(maxRetries, initialDelayMs, maxDelayMs, backoffFactor, jitter, retryable);
    }

    public Backoff backoff() {
        return new Backoff(initialDelayMs, maxDelayMs, backoffFactor, jitter);
    }
}
