package fr.lapetina.llm.tuner.concurrent;

import java.util.NoSuchElementException;

/**
 * Result of racing an operation against a timer.
 *
 * A {@link Status#TIMEOUT} outcome means no result was available by the deadline;
 * the raced operation may still be running.
 */
public record Outcome<T>(Status status, T value) {

    public enum Status {
        OK,
        TIMEOUT
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Status.OK, value);
    }

    public static <T> Outcome<T> timeout() {
        return new Outcome<>(Status.TIMEOUT, null);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isTimeout() {
        return status == Status.TIMEOUT;
    }

    /**
     * Returns the value of an OK outcome.
     *
     * @throws NoSuchElementException on a timeout outcome
     */
    public T get() {
        if (isTimeout()) {
            throw new NoSuchElementException("Operation timed out, no value available");
        }
        return value;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }
}
