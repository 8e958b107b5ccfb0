package fr.lapetina.llm.tuner.optimize;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches prompt-improvement hints to a candidate, leaving the pipeline itself unchanged.
 * Returns at most one variant per hint.
 */
public final class PromptHintMutationStrategy implements MutationStrategy {

    public static final String MUTATION_TYPE = "prompt-enhancement";

    static final List<String> HINTS = List.of(
            "Improve this by being more specific.",
            "Enhance the response quality.",
            "Think step by step.",
            "Consider the context more carefully.",
            "Be more precise in your answer.",
            "Focus on the key aspects."
    );

    @Override
    public List<Candidate> mutate(Candidate parent, int iteration, int count) {
        int variants = Math.min(Math.max(0, count), HINTS.size());
        List<Candidate> candidates = new ArrayList<>(variants);
        for (int i = 0; i < variants; i++) {
            candidates.add(Candidate.mutation(parent.pipeline(), iteration, HINTS.get(i), MUTATION_TYPE));
        }
        return candidates;
    }
}
