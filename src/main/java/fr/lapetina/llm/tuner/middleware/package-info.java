/**
 * Resilience middleware around {@link fr.lapetina.llm.tuner.domain.backend.LlmBackend}.
 *
 * <p>Each layer is a decorator implementing the backend interface:
 * <ul>
 *   <li>{@link fr.lapetina.llm.tuner.middleware.ThrottledBackend} - slot-reservation rate limiting</li>
 *   <li>{@link fr.lapetina.llm.tuner.middleware.RetryingBackend} - exponential backoff with jitter</li>
 *   <li>{@link fr.lapetina.llm.tuner.middleware.CircuitBreakerBackend} - fail fast while the backend is down</li>
 *   <li>{@link fr.lapetina.llm.tuner.middleware.TimeoutBackend} - TIMEOUT results instead of exceptions</li>
 *   <li>{@link fr.lapetina.llm.tuner.middleware.LoggingBackend} and
 *       {@link fr.lapetina.llm.tuner.middleware.MeteredBackend} - side effects only</li>
 * </ul>
 *
 * <p>{@link fr.lapetina.llm.tuner.middleware.MiddlewareStack} composes them.
 */
package fr.lapetina.llm.tuner.middleware;
