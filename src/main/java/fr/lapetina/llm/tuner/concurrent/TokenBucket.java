package fr.lapetina.llm.tuner.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Slot-reservation rate limiter.
 *
 * Every acquisition reserves {@code mySlot = max(nextSlot, now) + interval} with a single
 * compare-and-set on the shared slot cursor and waits until that slot. Successive
 * slots are therefore spaced by at least {@code 1000 / rps} ms across all callers,
 * without a queue and without blocking a thread.
 *
 * The burst size is kept for reporting only; spacing is steady-state.
 */
public final class TokenBucket {

    private static final Logger log = LoggerFactory.getLogger(TokenBucket.class);

    private final double rps;
    private final int burst;
    private final long intervalMicros;
    private final LongSupplier clockMillis;

    // Next free slot, epoch microseconds
    private final AtomicLong nextSlot = new AtomicLong(0);

    public TokenBucket(double rps, int burst, LongSupplier clockMillis) {
        if (rps <= 0) {
            throw new IllegalArgumentException("rps must be positive: " + rps);
        }
        this.rps = rps;
        this.burst = burst;
        this.intervalMicros = (long) Math.ceil(1_000_000.0 / rps);
        this.clockMillis = clockMillis;
        log.debug("TokenBucket created: rps={}, burst={}, intervalMicros={}", rps, burst, intervalMicros);
    }

    public TokenBucket(double rps, int burst) {
        this(rps, burst, System::currentTimeMillis);
    }

    /**
     * Reserves the next slot.
     *
     * @return Milliseconds the caller must wait before proceeding (0 if none)
     */
    public long reserve() {
        long now = clockMillis.getAsLong() * 1000L;
        long mySlot = nextSlot.updateAndGet(next -> Math.max(next, now) + intervalMicros);
        long waitMicros = mySlot - now;
        return waitMicros <= 0 ? 0 : (waitMicros + 999) / 1000;
    }

    /**
     * Reserves the next slot and returns a future completing when it is reached.
     */
    public CompletableFuture<Void> acquire() {
        long delayMs = reserve();
        if (delayMs == 0) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.delay(delayMs);
    }

    public double getRps() {
        return rps;
    }

    public int getBurst() {
        return burst;
    }

    public long getIntervalMicros() {
        return intervalMicros;
    }
}
