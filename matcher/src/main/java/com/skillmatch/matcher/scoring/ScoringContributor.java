package com.skillmatch.matcher.scoring;

/**
 * One weighted signal in the composite score.
 *
 * The composite is {@code 100 * sum(weight * signal)} over all registered
 * contributors, so adding a signal is a matter of declaring another
 * contributor bean; the scorer's contract does not change.
 *
 * <p>Implementations must be pure functions of the {@link ScoringContext}:
 * they run concurrently on the scoring pool and their output must be
 * reproducible.
 */
public interface ScoringContributor {

    /** Key used in the score explanation, e.g. "experience". Unique per scorer. */
    String name();

    /** Fixed weight in [0, 1]. Weights of all contributors sum to at most 1. */
    double weight();

    /**
     * Signal strength in [0, 1]. Values outside the range are clamped by the
     * scorer. Contributors without data for a pair return 0.0.
     */
    double signal(ScoringContext ctx);
}
