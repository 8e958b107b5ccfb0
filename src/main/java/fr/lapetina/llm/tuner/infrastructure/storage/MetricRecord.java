package fr.lapetina.llm.tuner.infrastructure.storage;

/**
 * One appended metric of a run.
 *
 * @param payload Checkpoint snapshot stored with the score, may be null
 */
public record MetricRecord(int iteration, double score, Object payload, long timestamp) {
}
