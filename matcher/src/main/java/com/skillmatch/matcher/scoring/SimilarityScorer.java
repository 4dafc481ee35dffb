package com.skillmatch.matcher.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scores a candidate skill set against a job skill set.
 *
 * <p>Similarity is the Jaccard index {@code |A ∩ B| / |A ∪ B|}, defined as
 * 1.0 when both sets are empty. The composite score is
 * {@code 100 * sum(weight * signal)} over the registered
 * {@link ScoringContributor}s, rounded once to 2 decimals (half-up). With the
 * default contributors that is {@code 60 * similarity}.
 *
 * <p>Spring collects every {@code ScoringContributor} bean in {@code @Order}
 * order and passes the list here.
 */
@Component
public class SimilarityScorer {

    private static final Logger log = LoggerFactory.getLogger(SimilarityScorer.class);

    private static final double SCALE = 100.0;
    private static final double WEIGHT_TOLERANCE = 1e-9;

    private final List<ScoringContributor> contributors;

    /**
     * @throws IllegalArgumentException on duplicate contributor names, negative
     *                                  weights, or weights summing to more than 1
     */
    public SimilarityScorer(List<ScoringContributor> contributors) {
        Set<String> names = new HashSet<>();
        double total = 0.0;
        for (ScoringContributor c : contributors) {
            if (!names.add(c.name())) {
                throw new IllegalArgumentException("Duplicate scoring contributor: '" + c.name() + "'");
            }
            if (c.weight() < 0.0) {
                throw new IllegalArgumentException(
                        "Negative weight %s for contributor '%s'".formatted(c.weight(), c.name()));
            }
            total += c.weight();
            log.info("Registered scoring contributor '{}' weight={}", c.name(), c.weight());
        }
        if (total > 1.0 + WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Contributor weights sum to " + total + " (limit: 1.0)");
        }
        this.contributors = List.copyOf(contributors);
    }

    /** Scorer with the canonical skill (0.60) / experience (0.25) / other (0.15) split. */
    public static SimilarityScorer withDefaultContributors() {
        return new SimilarityScorer(List.of(
                new SkillOverlapContributor(),
                new ExperienceContributor(),
                new OtherSignalsContributor()));
    }

    // ------------------------------------------------------------------
    // Scoring
    // ------------------------------------------------------------------

    /**
     * Score one pair of skill sets. Total over all inputs, including empty sets.
     *
     * @throws IllegalStateException if the matched set escapes the intersection
     *                               (a bug, never a bad-input condition)
     */
    public SkillScore score(Set<String> candidateSkills, Set<String> jobSkills) {
        double similarity = jaccard(candidateSkills, jobSkills);
        SortedSet<String> matched = intersection(candidateSkills, jobSkills);
        if (!candidateSkills.containsAll(matched) || !jobSkills.containsAll(matched)) {
            throw new IllegalStateException("Matched skills " + matched + " are not a subset of both skill sets");
        }

        ScoringContext ctx = new ScoringContext(candidateSkills, jobSkills, similarity);
        StringBuilder explanation = new StringBuilder()
                .append(SkillOverlapContributor.NAME).append('=').append(fmt(similarity));

        double blended = 0.0;
        for (ScoringContributor c : contributors) {
            double signal = clamp(c, c.signal(ctx));
            blended += c.weight() * signal;
            if (!SkillOverlapContributor.NAME.equals(c.name())) {
                explanation.append(' ').append(c.name()).append('=').append(fmt(signal));
            }
        }

        return new SkillScore(similarity, round2(SCALE * blended), matched, explanation.toString());
    }

    /** Jaccard index; 1.0 when both sets are empty. */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger  = smaller == a ? b : a;
        long inter = smaller.stream().filter(larger::contains).count();
        long union = a.size() + b.size() - inter;
        return (double) inter / union;
    }

    /** Skills present in both sets, sorted and unmodifiable. */
    public static SortedSet<String> intersection(Set<String> a, Set<String> b) {
        SortedSet<String> out = new TreeSet<>();
        for (String s : a) {
            if (b.contains(s)) out.add(s);
        }
        return Collections.unmodifiableSortedSet(out);
    }

    public List<ScoringContributor> contributors() {
        return contributors;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double clamp(ScoringContributor c, double signal) {
        if (Double.isNaN(signal) || signal < 0.0 || signal > 1.0) {
            double clamped = Double.isNaN(signal) ? 0.0 : Math.max(0.0, Math.min(1.0, signal));
            log.warn("Contributor '{}' returned signal {} outside [0, 1]; using {}", c.name(), signal, clamped);
            return clamped;
        }
        return signal;
    }

    /** Round half away from zero to 2 decimals, working on the shortest decimal form of the double. */
    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
