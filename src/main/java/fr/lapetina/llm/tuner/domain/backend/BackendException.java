package fr.lapetina.llm.tuner.domain.backend;

import fr.lapetina.llm.tuner.domain.model.ErrorType;

/**
 * Failure reported by a backend call.
 *
 * Carries the HTTP-like status code and the provider error category when the
 * provider supplied them, so that retry predicates can classify the failure.
 */
public class BackendException extends RuntimeException {

    private final int statusCode;
    private final String errorCategory;

    public BackendException(String message) {
        this(message, 0, null, null);
    }

    public BackendException(String message, int statusCode) {
        this(message, statusCode, null, null);
    }

    public BackendException(String message, int statusCode, String errorCategory) {
        this(message, statusCode, errorCategory, null);
    }

    public BackendException(String message, int statusCode, String errorCategory, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCategory = errorCategory;
    }

    /**
     * Returns the status code, or 0 when the failure did not come with one.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCategory() {
        return errorCategory;
    }

    public ErrorType getErrorType() {
        if (statusCode == 429 || statusCode >= 500) {
            return ErrorType.TRANSIENT;
        }
        if (statusCode >= 400) {
            return ErrorType.NON_RETRYABLE;
        }
        return ErrorType.INTERNAL_ERROR;
    }
}
