package com.skillmatch.matcher.scoring;

import java.util.SortedSet;

/**
 * Output of {@link SimilarityScorer#score}.
 *
 * @param similarity  Jaccard similarity in [0, 1].
 * @param composite   Weighted composite on the 0–100 scale, rounded to 2 decimals.
 * @param matched     Skills present in both sets (sorted, unmodifiable).
 * @param explanation e.g. {@code "skill_jaccard=0.500 experience=0.000 other=0.000"}.
 */
public record SkillScore(
        double            similarity,
        double            composite,
        SortedSet<String> matched,
        String            explanation) {}
