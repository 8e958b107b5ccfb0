package fr.lapetina.llm.tuner.optimize;

import java.util.List;

/**
 * Result of {@link BeamSearchOptimizer#analyzeConvergence}.
 *
 * @param variance Population variance of the recent scores, null when not computed
 * @param reason   Why convergence could not be assessed, null otherwise
 */
public record ConvergenceAnalysis(
        boolean converged,
        Double variance,
        double threshold,
        List<Double> recentScores,
        String reason
) {
    public static ConvergenceAnalysis insufficient(double threshold) {
        return new ConvergenceAnalysis(false, null, threshold, List.of(), "Insufficient iterations");
    }
}
