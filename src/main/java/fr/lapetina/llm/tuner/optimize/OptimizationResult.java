package fr.lapetina.llm.tuner.optimize;

import java.util.List;

/**
 * Outcome of an optimization run.
 *
 * {@code history} holds one entry per generation plus the seed, so its size is
 * {@code totalIterations + 1}.
 */
public record OptimizationResult(
        Candidate bestPipeline,
        double bestScore,
        List<HistoryEntry> history,
        int totalIterations,
        long totalTimeMs,
        boolean converged
) {
    public OptimizationResult {
        history = List.copyOf(history);
    }
}
