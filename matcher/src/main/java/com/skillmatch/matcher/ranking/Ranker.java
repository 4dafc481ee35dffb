package com.skillmatch.matcher.ranking;

import com.skillmatch.matcher.model.MatchResult;
import com.skillmatch.matcher.model.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders match results best-first and truncates to top-K.
 *
 * Ordering: score descending, then job id ascending. The tie-break makes
 * the output independent of input order (and of which worker finished
 * first); exact duplicates keep input order because {@link List#sort} is
 * stable.
 */
public final class Ranker {

    public static final Comparator<MatchResult> BEST_FIRST = Comparator
            .comparingDouble(MatchResult::score).reversed()
            .thenComparing(MatchResult::jobId);

    private Ranker() {}

    /**
     * @param topK Maximum number of results to return; null returns all.
     * @return A new unmodifiable list; {@code results} is not modified.
     * @throws ValidationException if topK is negative
     */
    public static List<MatchResult> rank(List<MatchResult> results, Integer topK) {
        requireValidTopK(topK);
        List<MatchResult> sorted = new ArrayList<>(results);
        sorted.sort(BEST_FIRST);
        int limit = topK == null ? sorted.size() : Math.min(topK, sorted.size());
        return List.copyOf(sorted.subList(0, limit));
    }

    /** @throws ValidationException if topK is negative */
    public static void requireValidTopK(Integer topK) {
        if (topK != null && topK < 0) {
            throw new ValidationException("top_k", "must be a non-negative integer, was " + topK);
        }
    }
}
