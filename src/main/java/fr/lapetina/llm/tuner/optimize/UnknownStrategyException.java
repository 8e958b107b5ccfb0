package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.domain.model.ErrorType;

import java.util.List;

/**
 * No optimization strategy is registered under the requested name.
 */
public class UnknownStrategyException extends RuntimeException {

    private final String strategy;
    private final List<String> availableStrategies;

    public UnknownStrategyException(String strategy, List<String> availableStrategies) {
        super("Unknown optimization strategy: " + strategy + ". Available: " + availableStrategies);
        this.strategy = strategy;
        this.availableStrategies = List.copyOf(availableStrategies);
    }

    public String getStrategy() {
        return strategy;
    }

    public List<String> getAvailableStrategies() {
        return availableStrategies;
    }

    public ErrorType getErrorType() {
        return ErrorType.VALIDATION_ERROR;
    }
}
