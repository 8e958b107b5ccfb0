package fr.lapetina.llm.tuner.domain.pipeline;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An LLM call pipeline: maps an input record to an output record.
 *
 * Implementations must be safe to invoke concurrently; the evaluator runs one
 * invocation per example, possibly in parallel.
 */
@FunctionalInterface
public interface Pipeline {

    /**
     * Runs the pipeline on one input.
     *
     * @param input Example fields, without ground-truth keys
     * @return Future of the output fields, or failed with the pipeline error
     */
    CompletableFuture<Map<String, Object>> invoke(Map<String, Object> input);
}
