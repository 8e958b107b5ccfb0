package fr.lapetina.llm.tuner.concurrent;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff schedule.
 *
 * delay(attempt) = min(maxDelay, initialDelay * factor^attempt), optionally scaled by a
 * uniform jitter factor in [0.5, 1.0].
 */
public final class Backoff {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double factor;
    private final boolean jitter;
    private final DoubleSupplier random;

    public Backoff(long initialDelayMs, long maxDelayMs, double factor, boolean jitter, DoubleSupplier random) {
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Backoff delays must be non-negative");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be >= 1.0: " + factor);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.factor = factor;
        this.jitter = jitter;
        this.random = random;
    }

    public Backoff(long initialDelayMs, long maxDelayMs, double factor, boolean jitter) {
        this(initialDelayMs, maxDelayMs, factor, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Returns the wait before retry number {@code attempt + 1}.
     *
     * @param attempt Zero-based index of the attempt that just failed
     */
    public long delayMillis(int attempt) {
        double base = initialDelayMs * Math.pow(factor, attempt);
        double capped = Math.min(base, maxDelayMs);
        if (jitter) {
            capped = capped * (0.5 + 0.5 * random.getAsDouble());
        }
        return (long) capped;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getFactor() {
        return factor;
    }

    public boolean isJitter() {
        return jitter;
    }

    @Override
    public String toString() {
        return "Backoff{" +
                "initialDelayMs=" + initialDelayMs +
                ", maxDelayMs=" + maxDelayMs +
                ", factor=" + factor +
                ", jitter=" + jitter +
                '}';
    }
}
