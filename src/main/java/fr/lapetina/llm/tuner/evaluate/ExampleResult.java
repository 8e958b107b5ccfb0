package fr.lapetina.llm.tuner.evaluate;

import java.util.Map;

/**
 * Outcome of evaluating one example.
 *
 * @param prediction  Pipeline output, null on failure
 * @param groundTruth Value the prediction was scored against
 * @param score       Metric score, 0.0 on failure
 * @param error       Failure cause, null on success
 */
public record ExampleResult(
        boolean success,
        Map<String, Object> example,
        Map<String, Object> prediction,
        Object groundTruth,
        double score,
        Throwable error,
        String metricName
) {
    public static ExampleResult success(
            Map<String, Object> example,
            Map<String, Object> prediction,
            Object groundTruth,
            double score,
            String metricName
    ) {
        return new ExampleResult(true, example, prediction, groundTruth, score, null, metricName);
    }

    public static ExampleResult failure(Map<String, Object> example, Object groundTruth, Throwable error, String metricName) {
        return new ExampleResult(false, example, null, groundTruth, 0.0, error, metricName);
    }

    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
