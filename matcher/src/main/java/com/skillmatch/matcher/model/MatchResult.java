package com.skillmatch.matcher.model;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Score of one job for one candidate. Immutable: {@code matchedSkills} is
 * copied into an unmodifiable sorted set on construction.
 *
 * @param score       Composite score on the 0–100 scale, rounded to 2 decimals.
 * @param explanation Machine-readable record of the signals behind the score,
 *                    e.g. {@code "skill_jaccard=0.500 experience=0.000 other=0.000"}.
 */
public record MatchResult(
        String            jobId,
        double            score,
        SortedSet<String> matchedSkills,
        String            explanation) {

    public MatchResult {
        Objects.requireNonNull(jobId, "jobId");
        matchedSkills = Collections.unmodifiableSortedSet(new TreeSet<>(matchedSkills));
    }
}
