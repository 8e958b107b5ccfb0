package fr.lapetina.llm.tuner.concurrent;

/**
 * A result paired with the wall time its future took.
 */
public record Timed<T>(T result, long elapsedMs) {
}
