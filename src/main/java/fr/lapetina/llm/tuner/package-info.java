/**
 * LLM Tuner - resilient LLM backend access, concurrent evaluation and beam-search
 * optimization of LLM call pipelines.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.tuner.TunerFactory} - Main entry point wiring a backend, its
 *       middleware, the evaluator and the optimizer from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.tuner.LlmTunerApplication} - Command line front end</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (TunerFactory factory = TunerFactory.create("config.yaml")) {
 *     OptimizationResult result = factory.getOptimizer()
 *             .optimize(factory.getPipeline(), trainset, Metrics.exactMatch(), factory.optimizerOptions())
 *             .join();
 *     System.out.println(result.bestScore());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Composable throttle, retry, circuit breaker, timeout, logging and metrics middleware</li>
 *   <li>Bounded-parallel evaluation with per-example timeouts</li>
 *   <li>Beam search with background checkpointing and resume</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.llm.tuner.TunerFactory
 * @see fr.lapetina.llm.tuner.optimize.BeamSearchOptimizer
 */
package fr.lapetina.llm.tuner;
