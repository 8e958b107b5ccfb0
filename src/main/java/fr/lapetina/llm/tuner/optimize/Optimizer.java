package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import fr.lapetina.llm.tuner.evaluate.Metric;
import fr.lapetina.llm.tuner.infrastructure.storage.MetricRecord;
import fr.lapetina.llm.tuner.infrastructure.storage.RunStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of pipeline optimization.
 *
 * Validates the inputs, registers the run in storage when no run id is given and
 * dispatches to the strategy named in the options.
 */
public final class Optimizer {

    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private final StrategyRegistry strategies;
    private final RunStorage storage;

    public Optimizer(StrategyRegistry strategies, RunStorage storage) {
        this.strategies = strategies;
        this.storage = storage;
    }

    /**
     * Optimizes the pipeline.
     *
     * @throws IllegalArgumentException if the trainset is empty
     * @throws UnknownStrategyException if the strategy is not registered
     */
    public CompletableFuture<OptimizationResult> optimize(
            Pipeline pipeline,
            List<Map<String, Object>> trainset,
            Metric metric,
            OptimizerOptions options
    ) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline is required");
        }
        if (trainset == null || trainset.isEmpty()) {
            throw new IllegalArgumentException("Invalid training dataset: at least one example is required");
        }
        if (metric == null) {
            throw new IllegalArgumentException("metric is required");
        }

        OptimizationStrategy strategy = strategies.get(options.strategy());
        OptimizerOptions effective = options.runId() != null ? options : options.withRunId(createRun(pipeline));

        return strategy.optimize(pipeline, trainset, metric, effective)
                .thenApply(result -> {
                    log.info("Optimization completed: strategy={}, runId={}, iterations={}, bestScore={}, converged={}",
                            effective.strategy(), effective.runId(), result.totalIterations(),
                            result.bestScore(), result.converged());
                    return result;
                });
    }

    /**
     * Resumes a run from its latest checkpoint, or starts it from {@code pipeline} when it
     * has none.
     */
    public CompletableFuture<OptimizationResult> resume(
            String runId,
            Pipeline pipeline,
            List<Map<String, Object>> trainset,
            Metric metric,
            OptimizerOptions options
    ) {
        Optional<Checkpoint> checkpoint = loadCheckpoint(runId);
        if (checkpoint.isPresent()) {
            Checkpoint latest = checkpoint.get();
            log.info("Resuming optimization from checkpoint: runId={}, iteration={}, score={}",
                    runId, latest.iteration(), latest.bestScore());
            return optimize(latest.bestPipeline().pipeline(), trainset, metric,
                    options.toBuilder().runId(runId).startIteration(latest.iteration()).build());
        }
        log.info("No checkpoint found, starting fresh optimization: runId={}", runId);
        return optimize(pipeline, trainset, metric, options.withRunId(runId));
    }

    Optional<Checkpoint> loadCheckpoint(String runId) {
        try {
            List<MetricRecord> history = storage.loadHistory(runId);
            for (int i = history.size() - 1; i >= 0; i--) {
                if (history.get(i).payload() instanceof Checkpoint checkpoint) {
                    return Optional.of(checkpoint);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Failed to load checkpoint: runId={}", runId, e);
        }
        return Optional.empty();
    }

    private String createRun(Pipeline pipeline) {
        try {
            String runId = storage.createRun(pipeline);
            log.info("Created optimization run: runId={}", runId);
            return runId;
        } catch (RuntimeException e) {
            log.warn("Failed to create optimization run, continuing without persistence", e);
            return UUID.randomUUID().toString();
        }
    }

    public int suggestBeamWidth(int trainsetSize, int concurrency) {
        return BeamSearchOptimizer.suggestBeamWidth(trainsetSize, concurrency);
    }

    public List<String> getAvailableStrategies() {
        return strategies.getAvailableStrategies();
    }
}
