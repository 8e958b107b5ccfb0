package fr.lapetina.llm.tuner.optimize;

import java.util.List;

/**
 * Snapshot of a run in progress, stored as the payload of a checkpoint metric.
 */
public record Checkpoint(
        int iteration,
        Candidate bestPipeline,
        double bestScore,
        List<HistoryEntry> history,
        long totalTimeMs
) {
    public Checkpoint {
        history = List.copyOf(history);
    }
}
