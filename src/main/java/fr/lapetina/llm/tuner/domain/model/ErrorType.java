package fr.lapetina.llm.tuner.domain.model;

/**
 * Error taxonomy for backend calls, evaluations and optimization runs.
 * Provides clear categorization for logging, retry decisions and metrics.
 */
public enum ErrorType {
    /** Network, timeout, 5xx, 429 or provider-side transient failure */
    TRANSIENT,

    /** 4xx (other than 429) or any failure a retry cannot fix */
    NON_RETRYABLE,

    /** Circuit breaker rejected the call without reaching the backend */
    CIRCUIT_OPEN,

    /** No result available before the deadline */
    TIMEOUT,

    /** Malformed input, configuration or metric score */
    VALIDATION_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
