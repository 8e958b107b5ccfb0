package fr.lapetina.llm.tuner.evaluate;

import fr.lapetina.llm.tuner.domain.model.ErrorType;

/**
 * The dataset is in none of the shapes {@link Datasets#format} understands.
 */
public class UnsupportedDatasetException extends RuntimeException {

    public UnsupportedDatasetException(String message) {
        super(message);
    }

    public ErrorType getErrorType() {
        return ErrorType.VALIDATION_ERROR;
    }
}
