package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import fr.lapetina.llm.tuner.evaluate.Metric;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns the initial pipeline unchanged without evaluating it.
 * Used for dry runs and to test the optimizer plumbing.
 */
public final class IdentityStrategy implements OptimizationStrategy {

    @Override
    public CompletableFuture<OptimizationResult> optimize(
            Pipeline initial,
            List<Map<String, Object>> trainset,
            Metric metric,
            OptimizerOptions options
    ) {
        long now = System.currentTimeMillis();
        Candidate candidate = Candidate.initial(initial).withScore(0.0);
        HistoryEntry seed = new HistoryEntry(0, 0.0, candidate, now, 0, 0);
        return CompletableFuture.completedFuture(
                new OptimizationResult(candidate, 0.0, List.of(seed), 0, 0, true));
    }
}
