/**
 * Future combinators used by the middleware, the evaluator and the optimizer:
 * bounded-parallel maps, timeout races returning an {@link fr.lapetina.llm.tuner.concurrent.Outcome},
 * retry with {@link fr.lapetina.llm.tuner.concurrent.Backoff}, and the
 * {@link fr.lapetina.llm.tuner.concurrent.TokenBucket} rate limiter.
 */
package fr.lapetina.llm.tuner.concurrent;
