package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.domain.model.ErrorType;

/**
 * Thrown when the circuit breaker rejects a call without reaching the backend.
 */
public class CircuitOpenException extends RuntimeException {

    private final CircuitBreaker.Snapshot snapshot;

    public CircuitOpenException(String name, CircuitBreaker.Snapshot snapshot) {
        super("Circuit breaker is open: name=" + name + ", failures=" + snapshot.failures());
        this.snapshot = snapshot;
    }

    public CircuitBreaker.Snapshot getSnapshot() {
        return snapshot;
    }

    public ErrorType getErrorType() {
        return ErrorType.CIRCUIT_OPEN;
    }
}
