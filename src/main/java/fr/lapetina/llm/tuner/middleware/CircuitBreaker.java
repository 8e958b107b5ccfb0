package fr.lapetina.llm.tuner.middleware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.function.LongSupplier;

/**
 * Circuit breaker guarding a single backend.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through and failures are counted
 * - OPEN: Failure threshold reached, calls rejected until the recovery timeout
 *   has elapsed since the last failure
 * - HALF_OPEN: Recovery probe, calls pass through; enough successes close the
 *   circuit, any failure re-opens it
 *
 * State is an immutable {@link Snapshot}; every admission check and every recorded
 * outcome replaces it in one synchronized read-modify-write.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * Point-in-time view of the breaker.
     *
     * @param lastFailureTime Epoch millis of the failure that opened the circuit, or null
     */
    public record Snapshot(State state, int failures, int successes, Long lastFailureTime) {
        static final Snapshot INITIAL = new Snapshot(State.CLOSED, 0, 0, null);
    }

    private final String name;
    private final CircuitBreakerOptions options;
    private final LongSupplier clockMillis;

    private Snapshot snapshot = Snapshot.INITIAL;

    public CircuitBreaker(String name, CircuitBreakerOptions options, LongSupplier clockMillis) {
        this.name = name;
        this.options = options;
        this.clockMillis = clockMillis;
    }

    public CircuitBreaker(String name, CircuitBreakerOptions options) {
        this(name, options, System::currentTimeMillis);
    }

    public CircuitBreaker(String name) {
        this(name, CircuitBreakerOptions.defaults());
    }

    /**
     * Checks whether a call may proceed, moving OPEN to HALF_OPEN once the timeout elapsed.
     *
     * @return true if the call should proceed, false if the circuit is open
     */
    public synchronized boolean allowRequest() {
        switch (snapshot.state()) {
            case CLOSED:
            case HALF_OPEN:
                return true;
            case OPEN:
                long elapsed = clockMillis.getAsLong() - snapshot.lastFailureTime();
                if (elapsed > options.timeoutMs()) {
                    snapshot = new Snapshot(State.HALF_OPEN, snapshot.failures(), 0, snapshot.lastFailureTime());
                    log.info("Circuit breaker transitioning to HALF_OPEN: name={}", name);
                    return true;
                }
                return false;
            default:
                return true;
        }
    }

    /**
     * Records a successful call.
     */
    public synchronized void recordSuccess() {
        Snapshot current = snapshot;
        if (current.state() == State.HALF_OPEN) {
            int successes = current.successes() + 1;
            if (successes >= options.successThreshold()) {
                snapshot = Snapshot.INITIAL;
                log.info("Circuit breaker CLOSED after recovery: name={}", name);
            } else {
                snapshot = new Snapshot(State.HALF_OPEN, current.failures(), successes, current.lastFailureTime());
            }
        } else if (current.state() == State.CLOSED && current.failures() > 0) {
            // Only consecutive failures open the circuit
            snapshot = Snapshot.INITIAL;
        }
    }

    /**
     * Records a failed call.
     */
    public synchronized void recordFailure() {
        Snapshot current = snapshot;
        long now = clockMillis.getAsLong();

        if (current.state() == State.HALF_OPEN) {
            snapshot = new Snapshot(State.OPEN, current.failures() + 1, 0, now);
            log.warn("Circuit breaker OPENED (half-open failure): name={}", name);
            return;
        }

        int failures = current.failures() + 1;
        if (current.state() == State.CLOSED && failures >= options.failureThreshold()) {
            snapshot = new Snapshot(State.OPEN, failures, 0, now);
            log.warn("Circuit breaker OPENED: name={}, failures={}", name, failures);
        } else if (current.state() == State.OPEN) {
            snapshot = new Snapshot(State.OPEN, failures, 0, current.lastFailureTime());
        } else {
            snapshot = new Snapshot(current.state(), failures, current.successes(), current.lastFailureTime());
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(State newState) {
        State old = snapshot.state();
        snapshot = switch (newState) {
            case CLOSED -> Snapshot.INITIAL;
            case OPEN -> new Snapshot(State.OPEN, snapshot.failures(), 0, clockMillis.getAsLong());
            case HALF_OPEN -> new Snapshot(State.HALF_OPEN, snapshot.failures(), 0, snapshot.lastFailureTime());
        };
        log.info("Circuit breaker forced from {} to {}: name={}", old, newState, name);
    }

    public synchronized Snapshot snapshot() {
        return snapshot;
    }

    public State getState() {
        return snapshot().state();
    }

    public int getFailureCount() {
        return snapshot().failures();
    }

    /**
     * Returns the time of the failure that last opened the circuit, or null.
     */
    public Instant getLastFailureTime() {
        Long time = snapshot().lastFailureTime();
        return time != null ? Instant.ofEpochMilli(time) : null;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        Snapshot current = snapshot();
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + current.state() +
                ", failures=" + current.failures() +
                '}';
    }
}
