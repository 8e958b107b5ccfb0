/**
 * Evaluation engine: runs a {@link fr.lapetina.llm.tuner.domain.pipeline.Pipeline} over a
 * dataset, scores every output with a {@link fr.lapetina.llm.tuner.evaluate.Metric} and
 * aggregates the scores.
 */
package fr.lapetina.llm.tuner.evaluate;
