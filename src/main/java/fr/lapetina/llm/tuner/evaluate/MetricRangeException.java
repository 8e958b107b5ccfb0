package fr.lapetina.llm.tuner.evaluate;

import fr.lapetina.llm.tuner.domain.model.ErrorType;

/**
 * A metric returned a score outside [0.0, 1.0].
 *
 * This is a programming error in the metric: it fails the whole evaluation instead of
 * being recorded as a per-example failure, and it is never retried.
 */
public class MetricRangeException extends RuntimeException {

    private final String metricName;
    private final double score;

    public MetricRangeException(String metricName, double score) {
        super("Metric must return a number between 0.0 and 1.0: metric=" + metricName + ", score=" + score);
        this.metricName = metricName;
        this.score = score;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getScore() {
        return score;
    }

    public ErrorType getErrorType() {
        return ErrorType.VALIDATION_ERROR;
    }
}
