package fr.lapetina.llm.tuner.domain.pipeline;

import fr.lapetina.llm.tuner.domain.model.ErrorType;

/**
 * Raised by a pipeline when the backend returned a TIMEOUT result.
 */
public class BackendTimeoutException extends RuntimeException {

    public BackendTimeoutException(String message) {
        super(message);
    }

    public ErrorType getErrorType() {
        return ErrorType.TIMEOUT;
    }
}
