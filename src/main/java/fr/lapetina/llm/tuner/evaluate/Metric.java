package fr.lapetina.llm.tuner.evaluate;

/**
 * Scores a prediction against its ground truth.
 *
 * Scores must lie in [0.0, 1.0]; wrap custom metrics with {@link Metrics#validated}
 * to enforce the range.
 */
@FunctionalInterface
public interface Metric {

    double score(Object prediction, Object groundTruth);

    default String name() {
        return "custom";
    }
}
