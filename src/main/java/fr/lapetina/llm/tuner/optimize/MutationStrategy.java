package fr.lapetina.llm.tuner.optimize;

import java.util.List;

/**
 * Produces the variants of a beam candidate for the next generation.
 */
@FunctionalInterface
public interface MutationStrategy {

    /**
     * @param parent    Beam candidate to vary
     * @param iteration Generation being built, starting at 1
     * @param count     Number of variants wanted; implementations may return fewer
     */
    List<Candidate> mutate(Candidate parent, int iteration, int count);
}
