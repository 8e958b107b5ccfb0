package fr.lapetina.llm.tuner.domain.model;

/**
 * Status discriminator carried by backend results.
 *
 * A timed-out call completes normally with {@link #TIMEOUT} instead of failing,
 * so callers must check the status before reading the payload.
 */
public enum ResultStatus {
    OK,
    TIMEOUT
}
