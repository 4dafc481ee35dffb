package com.skillmatch.matcher.scoring;

import java.util.Set;

/**
 * Inputs available to every {@link ScoringContributor} for one candidate/job pair.
 *
 * @param skillSimilarity Jaccard similarity of the two skill sets, already computed
 *                        by the scorer so contributors don't repeat the work.
 */
public record ScoringContext(
        Set<String> candidateSkills,
        Set<String> jobSkills,
        double      skillSimilarity) {}
