/**
 * Immutable value types exchanged with LLM backends.
 *
 * <p>Results carry a {@link fr.lapetina.llm.tuner.domain.model.ResultStatus} so that a
 * timeout can be reported as a value rather than as an exception.
 */
package fr.lapetina.llm.tuner.domain.model;
