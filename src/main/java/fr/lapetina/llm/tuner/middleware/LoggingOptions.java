package fr.lapetina.llm.tuner.middleware;

/**
 * Which events the logging layer reports.
 */
public record LoggingOptions(boolean logRequests, boolean logResponses, boolean logErrors) {

    public static LoggingOptions defaults() {
        return new LoggingOptions(true, false, true);
    }
}
