package fr.lapetina.llm.tuner.optimize;

/**
 * Record of one optimizer generation; iteration 0 is the seed.
 *
 * @param pipeline Best candidate of the generation
 */
public record HistoryEntry(
        int iteration,
        double score,
        Candidate pipeline,
        long timestamp,
        long iterationTimeMs,
        int candidatesEvaluated
) {
}
