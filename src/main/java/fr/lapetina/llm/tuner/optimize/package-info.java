/**
 * Pipeline optimization.
 *
 * <p>{@link fr.lapetina.llm.tuner.optimize.Optimizer} dispatches to a registered
 * {@link fr.lapetina.llm.tuner.optimize.OptimizationStrategy}; the default one is
 * {@link fr.lapetina.llm.tuner.optimize.BeamSearchOptimizer}. Candidates are scored with the
 * {@link fr.lapetina.llm.tuner.evaluate.Evaluator} and checkpoints go to a
 * {@link fr.lapetina.llm.tuner.infrastructure.storage.RunStorage} through the
 * {@link fr.lapetina.llm.tuner.optimize.CheckpointWriter}.
 */
package fr.lapetina.llm.tuner.optimize;
