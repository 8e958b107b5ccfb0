package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.concurrent.Futures;
import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import fr.lapetina.llm.tuner.evaluate.EvaluationOptions;
import fr.lapetina.llm.tuner.evaluate.EvaluationResult;
import fr.lapetina.llm.tuner.evaluate.Evaluator;
import fr.lapetina.llm.tuner.evaluate.Metric;
import fr.lapetina.llm.tuner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Beam search over pipeline candidates.
 *
 * Each generation:
 * 1. every beam candidate yields {@code 2 + iteration} variants, capped at
 *    {@code floor(beamWidth * max(2, beamWidth / 2))} in total
 * 2. all variants are evaluated against the trainset, {@code concurrency} at a time
 * 3. a stable sort by score keeps the best {@code beamWidth}
 * 4. every {@code checkpointInterval} generations a snapshot is handed to the
 *    checkpoint writer without waiting for it
 *
 * The search stops after {@code maxIterations} generations; there is no early exit.
 */
public final class BeamSearchOptimizer implements OptimizationStrategy {

    private static final Logger log = LoggerFactory.getLogger(BeamSearchOptimizer.class);

    private static final double CONVERGENCE_TOLERANCE = 0.01;

    private final Evaluator evaluator;
    private final MutationStrategy mutationStrategy;
    private final CheckpointWriter checkpointWriter;
    private final MetricsRegistry metrics;

    /**
     * @param checkpointWriter Destination of checkpoints, or null to disable them
     * @param metrics          Registry for iteration metrics, or null
     */
    public BeamSearchOptimizer(
            Evaluator evaluator,
            MutationStrategy mutationStrategy,
            CheckpointWriter checkpointWriter,
            MetricsRegistry metrics
    ) {
        this.evaluator = evaluator;
        this.mutationStrategy = mutationStrategy;
        this.checkpointWriter = checkpointWriter;
        this.metrics = metrics;
    }

    public BeamSearchOptimizer(Evaluator evaluator, CheckpointWriter checkpointWriter) {
        this(evaluator, new PromptHintMutationStrategy(), checkpointWriter, null);
    }

    @Override
    public CompletableFuture<OptimizationResult> optimize(
            Pipeline initial,
            List<Map<String, Object>> trainset,
            Metric metric,
            OptimizerOptions options
    ) {
        long start = System.currentTimeMillis();
        String runId = options.runId() != null ? options.runId() : "beam-" + start;
        Search search = new Search(trainset, metric, options, runId, start);

        log.info("Starting beam search optimization: runId={}, beamWidth={}, maxIterations={}, concurrency={}, examples={}",
                runId, options.beamWidth(), options.maxIterations(), options.concurrency(), trainset.size());

        int seedIteration = options.startIteration();
        return search.score(Candidate.initial(initial).withIteration(seedIteration))
                .thenCompose(seed -> {
                    log.debug("Initial pipeline scored: score={}", seed.score());
                    HistoryEntry entry = new HistoryEntry(seedIteration, seed.scoreOrZero(), seed,
                            System.currentTimeMillis(), 0, 1);
                    return search.iterate(List.of(seed), seedIteration + 1, List.of(entry));
                });
    }

    /**
     * State shared by the generations of one run. Beam and history are passed along as
     * immutable lists.
     */
    private final class Search {
        private final List<Map<String, Object>> trainset;
        private final Metric metric;
        private final OptimizerOptions options;
        private final String runId;
        private final long start;
        private final EvaluationOptions evaluationOptions;

        Search(List<Map<String, Object>> trainset, Metric metric, OptimizerOptions options, String runId, long start) {
            this.trainset = trainset;
            this.metric = metric;
            this.options = options;
            this.runId = runId;
            this.start = start;
            this.evaluationOptions = new EvaluationOptions(false, 1, options.exampleTimeoutMs());
        }

        CompletableFuture<OptimizationResult> iterate(List<Candidate> beam, int iteration, List<HistoryEntry> history) {
            if (iteration > options.maxIterations()) {
                return CompletableFuture.completedFuture(finish(beam, history));
            }

            long iterationStart = System.currentTimeMillis();
            List<Candidate> candidates = generateCandidates(beam, iteration, options.beamWidth());
            log.debug("Generated candidates: iteration={}, count={}", iteration, candidates.size());

            return Futures.parallelMap(options.concurrency(), this::score, candidates)
                    .thenCompose(scored -> {
                        List<Candidate> selected = selectTopCandidates(scored, options.beamWidth());
                        Candidate best = selected.get(0);
                        long iterationTime = System.currentTimeMillis() - iterationStart;

                        List<HistoryEntry> nextHistory = new ArrayList<>(history);
                        nextHistory.add(new HistoryEntry(iteration, best.scoreOrZero(), best,
                                System.currentTimeMillis(), iterationTime, scored.size()));

                        log.debug("Beam iteration completed: iteration={}, bestScore={}, selected={}, iterationTimeMs={}",
                                iteration, best.scoreOrZero(), selected.size(), iterationTime);
                        if (metrics != null) {
                            metrics.recordIteration(Duration.ofMillis(iterationTime), best.scoreOrZero());
                        }

                        if (iteration % options.checkpointInterval() == 0) {
                            checkpoint(iteration, best, nextHistory);
                        }
                        return iterate(selected, iteration + 1, List.copyOf(nextHistory));
                    });
        }

        CompletableFuture<Candidate> score(Candidate candidate) {
            return evaluator.evaluate(candidate.pipeline(), trainset, metric, evaluationOptions)
                    .thenApply(EvaluationResult::score)
                    .thenApply(candidate::withScore);
        }

        private void checkpoint(int iteration, Candidate best, List<HistoryEntry> history) {
            if (checkpointWriter == null) {
                return;
            }
            Checkpoint snapshot = new Checkpoint(iteration, best, best.scoreOrZero(), history,
                    System.currentTimeMillis() - start);
            checkpointWriter.submit(runId, iteration, best.scoreOrZero(), snapshot);
        }

        private OptimizationResult finish(List<Candidate> beam, List<HistoryEntry> history) {
            Candidate best = beam.get(0);
            double bestScore = best.scoreOrZero();
            long totalTime = System.currentTimeMillis() - start;
            int totalIterations = history.size() - 1;
            boolean converged = Math.abs(bestScore - 1.0) < CONVERGENCE_TOLERANCE;

            log.info("Beam search completed: runId={}, iterations={}, bestScore={}, totalTimeMs={}",
                    runId, totalIterations, bestScore, totalTime);
            return new OptimizationResult(best, bestScore, history, totalIterations, totalTime, converged);
        }
    }

    /**
     * Builds the variants of the next generation.
     */
    List<Candidate> generateCandidates(List<Candidate> beam, int iteration, int beamWidth) {
        int limit = maxCandidates(beamWidth);
        List<Candidate> candidates = new ArrayList<>(limit);
        for (Candidate parent : beam) {
            for (Candidate variant : mutationStrategy.mutate(parent, iteration, 2 + iteration)) {
                if (candidates.size() >= limit) {
                    return candidates;
                }
                candidates.add(variant);
            }
        }
        return candidates;
    }

    /**
     * Total candidate cap per generation: {@code floor(beamWidth * max(2, beamWidth / 2))}.
     */
    static int maxCandidates(int beamWidth) {
        return (int) Math.floor(beamWidth * Math.max(2.0, beamWidth / 2.0));
    }

    /**
     * Keeps the {@code beamWidth} best candidates by descending score.
     *
     * The sort is stable, so ties keep their input order and applying this to its own
     * output returns the same list.
     */
    public static List<Candidate> selectTopCandidates(List<Candidate> candidates, int beamWidth) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(Candidate::scoreOrZero).reversed());
        return List.copyOf(sorted.subList(0, Math.min(beamWidth, sorted.size())));
    }

    /**
     * Checks whether the last three scores have settled.
     *
     * @return converged when their population variance is below the threshold; fewer
     *         than three entries are never converged
     */
    public static ConvergenceAnalysis analyzeConvergence(List<HistoryEntry> history, double threshold) {
        if (history.size() < 3) {
            return ConvergenceAnalysis.insufficient(threshold);
        }
        List<Double> recent = history.subList(history.size() - 3, history.size()).stream()
                .map(HistoryEntry::score)
                .toList();
        double mean = recent.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = recent.stream()
                .mapToDouble(score -> (score - mean) * (score - mean))
                .sum() / recent.size();
        return new ConvergenceAnalysis(variance < threshold, variance, threshold, recent, null);
    }

    /**
     * Suggests a beam width from the training set size, limited by half the concurrency.
     * Never below 2.
     */
    public static int suggestBeamWidth(int trainsetSize, int concurrency) {
        int base;
        if (trainsetSize < 10) {
            base = 2;
        } else if (trainsetSize < 50) {
            base = 4;
        } else if (trainsetSize < 200) {
            base = 6;
        } else {
            base = 8;
        }
        double adjusted = Math.min(base, concurrency / 2.0);
        int suggested = (int) Math.max(2, adjusted);
        log.debug("Beam width suggestion: trainsetSize={}, concurrency={}, suggested={}",
                trainsetSize, concurrency, suggested);
        return suggested;
    }
}
