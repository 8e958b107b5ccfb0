package fr.lapetina.llm.tuner.evaluate;

import java.util.List;

/**
 * Aggregate of an evaluation run.
 *
 * @param score   Mean score over successful examples, 0.0 when none succeeded
 * @param count   Number of successful examples
 * @param total   Number of examples
 * @param results Per-example results, in dataset order
 * @param errors  Failed results, in dataset order
 */
public record EvaluationResult(
        double score,
        int count,
        int total,
        List<ExampleResult> results,
        List<ExampleResult> errors
) {
    public EvaluationResult {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }

    /**
     * Builds the aggregate from per-example results.
     */
    public static EvaluationResult of(List<ExampleResult> results) {
        List<ExampleResult> successful = results.stream().filter(ExampleResult::success).toList();
        List<ExampleResult> failed = results.stream().filter(r -> !r.success()).toList();
        double score = successful.stream().mapToDouble(ExampleResult::score).average().orElse(0.0);
        return new EvaluationResult(score, successful.size(), results.size(), results, failed);
    }
}
