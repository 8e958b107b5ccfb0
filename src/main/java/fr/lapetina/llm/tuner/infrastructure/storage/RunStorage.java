package fr.lapetina.llm.tuner.infrastructure.storage;

import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Persisted state of optimization runs.
 *
 * Implementations must be thread-safe: checkpoints are appended from a background thread.
 */
public interface RunStorage {

    /**
     * Registers a new run for the pipeline.
     *
     * @return Generated run identifier
     */
    String createRun(Pipeline pipeline);

    /**
     * Appends a metric to the run history. Unknown run identifiers start a new history.
     */
    void appendMetric(String runId, int iteration, double score, Object payload);

    /**
     * Returns the pipeline the run was created with.
     */
    Optional<Pipeline> loadRun(String runId);

    /**
     * Returns the run history in append order, empty for an unknown run.
     */
    List<MetricRecord> loadHistory(String runId);
}
