package fr.lapetina.llm.tuner.infrastructure.io.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llm.tuner.optimize.Candidate;
import fr.lapetina.llm.tuner.optimize.HistoryEntry;
import fr.lapetina.llm.tuner.optimize.OptimizationResult;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of an optimization result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
        @JsonProperty("run_id") String runId,
        @JsonProperty("best_score") double bestScore,
        @JsonProperty("best_pipeline") String bestPipeline,
        @JsonProperty("best_mutation") String bestMutation,
        @JsonProperty("total_iterations") int totalIterations,
        @JsonProperty("total_time_ms") long totalTimeMs,
        boolean converged,
        @JsonProperty("completed_at") Instant completedAt,
        List<Iteration> history
) {

    /**
     * One history entry.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Iteration(
            int iteration,
            double score,
            String mutation,
            @JsonProperty("iteration_time_ms") long iterationTimeMs,
            @JsonProperty("candidates_evaluated") int candidatesEvaluated
    ) {
        static Iteration from(HistoryEntry entry) {
            return new Iteration(entry.iteration(), entry.score(), entry.pipeline().mutationDescription(),
                    entry.iterationTimeMs(), entry.candidatesEvaluated());
        }
    }

    public static RunSummary from(String runId, OptimizationResult result) {
        Candidate best = result.bestPipeline();
        return new RunSummary(
                runId,
                result.bestScore(),
                best.pipeline().toString(),
                best.mutationDescription(),
                result.totalIterations(),
                result.totalTimeMs(),
                result.converged(),
                Instant.now(),
                result.history().stream().map(Iteration::from).toList()
        );
    }
}
