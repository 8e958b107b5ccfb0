package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import fr.lapetina.llm.tuner.evaluate.Metric;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A search procedure improving a pipeline against a training set.
 */
@FunctionalInterface
public interface OptimizationStrategy {

    CompletableFuture<OptimizationResult> optimize(
            Pipeline initial,
            List<Map<String, Object>> trainset,
            Metric metric,
            OptimizerOptions options
    );
}
