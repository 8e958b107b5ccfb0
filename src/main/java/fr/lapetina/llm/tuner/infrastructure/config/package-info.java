/**
 * YAML configuration loaded with SnakeYAML into {@link fr.lapetina.llm.tuner.infrastructure.config.TunerConfig}.
 *
 * <p>Example:
 * <pre>
 * backend:
 *   provider: echo
 *   model: echo-1
 * middleware:
 *   retry:
 *     maxRetries: 3
 *   timeout:
 *     timeoutMs: 15000
 * optimization:
 *   beamWidth: 4
 *   maxIterations: 10
 * </pre>
 *
 * <p>LLM_TUNER_PROVIDER, LLM_TUNER_MODEL, LLM_TUNER_BEAM_WIDTH, LLM_TUNER_MAX_ITERATIONS,
 * LLM_TUNER_CONCURRENCY and LLM_TUNER_TIMEOUT_MS override the file.
 */
package fr.lapetina.llm.tuner.infrastructure.config;
