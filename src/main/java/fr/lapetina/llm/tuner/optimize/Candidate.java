package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;

/**
 * A pipeline variant under evaluation, with its score and generation.
 *
 * @param score               Null until the candidate is scored
 * @param mutationDescription Hint that produced the variant, null for the initial pipeline
 * @param mutationType        Kind of mutation, null for the initial pipeline
 */
public record Candidate(
        Pipeline pipeline,
        Double score,
        int iteration,
        String mutationDescription,
        String mutationType
) {
    public Candidate {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline is required");
        }
    }

    public static Candidate initial(Pipeline pipeline) {
        return new Candidate(pipeline, null, 0, null, null);
    }

    public static Candidate mutation(Pipeline pipeline, int iteration, String description, String type) {
        return new Candidate(pipeline, null, iteration, description, type);
    }

    public Candidate withScore(double score) {
        return new Candidate(pipeline, score, iteration, mutationDescription, mutationType);
    }

    public Candidate withIteration(int iteration) {
        return new Candidate(pipeline, score, iteration, mutationDescription, mutationType);
    }

    /**
     * Returns the score, or 0.0 when not scored yet.
     */
    public double scoreOrZero() {
        return score != null ? score : 0.0;
    }
}
