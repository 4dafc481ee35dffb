package com.skillmatch.matcher.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for SimilarityScorer and the default contributors.
 * No Spring context; contributors are wired manually.
 */
class SimilarityScorerTest {

    private final SimilarityScorer scorer = SimilarityScorer.withDefaultContributors();

    // ------------------------------------------------------------------
    // Jaccard similarity
    // ------------------------------------------------------------------

    @Test
    void jaccard_halfOverlap_returnsHalf() {
        assertThat(SimilarityScorer.jaccard(Set.of("python", "rust"), Set.of("rust")))
                .isEqualTo(0.5);
    }

    @Test
    void jaccard_bothEmpty_returnsOne() {
        assertThat(SimilarityScorer.jaccard(Set.of(), Set.of())).isEqualTo(1.0);
    }

    @Test
    void jaccard_oneSideEmpty_returnsZero() {
        assertThat(SimilarityScorer.jaccard(Set.of("rust"), Set.of())).isEqualTo(0.0);
        assertThat(SimilarityScorer.jaccard(Set.of(), Set.of("rust"))).isEqualTo(0.0);
    }

    @Test
    void jaccard_disjoint_returnsZero() {
        assertThat(SimilarityScorer.jaccard(Set.of("java"), Set.of("rust", "python"))).isEqualTo(0.0);
    }

    @Test
    void jaccard_identicalSets_returnsOne() {
        Set<String> skills = Set.of("docker", "kubernetes", "linux");
        assertThat(SimilarityScorer.jaccard(skills, skills)).isEqualTo(1.0);
    }

    @Test
    void jaccard_isSymmetricAndBounded() {
        List<Set<String>> sets = List.of(
                Set.of(), Set.of("rust"), Set.of("rust", "python"),
                Set.of("sql", "postgresql", "docker"), Set.of("python", "sql"));
        for (Set<String> a : sets) {
            for (Set<String> b : sets) {
                double ab = SimilarityScorer.jaccard(a, b);
                assertThat(ab).isBetween(0.0, 1.0);
                assertThat(ab).isEqualTo(SimilarityScorer.jaccard(b, a));
            }
        }
    }

    // ------------------------------------------------------------------
    // Composite score
    // ------------------------------------------------------------------

    @Test
    void score_halfOverlap_compositeIsThirty() {
        SkillScore s = scorer.score(Set.of("python", "rust"), Set.of("rust"));

        assertThat(s.similarity()).isEqualTo(0.5);
        assertThat(s.composite()).isEqualTo(30.00);
        assertThat(s.matched()).containsExactly("rust");
    }

    @Test
    void score_bothEmpty_compositeIsSixty() {
        SkillScore s = scorer.score(Set.of(), Set.of());

        assertThat(s.similarity()).isEqualTo(1.0);
        assertThat(s.composite()).isEqualTo(60.00);
        assertThat(s.matched()).isEmpty();
    }

    @Test
    void score_perfectMatch_isNotRescaledBeyondSixty() {
        SkillScore s = scorer.score(Set.of("java", "sql"), Set.of("java", "sql"));
        assertThat(s.composite()).isEqualTo(60.00);
    }

    @Test
    void score_oneThirdOverlap_roundedToTwoDecimals() {
        SkillScore s = scorer.score(Set.of("rust"), Set.of("rust", "python", "sql"));
        assertThat(s.composite()).isEqualTo(20.00);
    }

    @Test
    void score_twoSevenths_roundedHalfUp() {
        // 60 * 2/7 = 17.142857...
        SkillScore s = scorer.score(Set.of("a", "b", "c", "d"), Set.of("a", "b", "e", "f", "g"));
        assertThat(s.composite()).isEqualTo(17.14);
    }

    @Test
    void round2_halfwayValue_roundsAwayFromZero() {
        assertThat(SimilarityScorer.round2(12.345)).isEqualTo(12.35);
        assertThat(SimilarityScorer.round2(12.344)).isEqualTo(12.34);
    }

    @Test
    void score_matched_isIntersection() {
        Set<String> a = Set.of("python", "rust", "docker");
        Set<String> b = Set.of("rust", "docker", "kubernetes");

        SkillScore s = scorer.score(a, b);

        assertThat(s.matched()).containsExactly("docker", "rust");
        assertThat(a).containsAll(s.matched());
        assertThat(b).containsAll(s.matched());
    }

    // ------------------------------------------------------------------
    // Explanation
    // ------------------------------------------------------------------

    @Test
    void score_explanation_recordsJaccardToThreeDecimals() {
        SkillScore s = scorer.score(Set.of("rust"), Set.of("rust", "python", "sql"));
        assertThat(s.explanation()).isEqualTo("skill_jaccard=0.333 experience=0.000 other=0.000");
    }

    @Test
    void score_sameInputs_sameExplanation() {
        assertThat(scorer.score(Set.of("a"), Set.of("a", "b")).explanation())
                .isEqualTo(scorer.score(Set.of("a"), Set.of("a", "b")).explanation());
    }

    // ------------------------------------------------------------------
    // Pluggable contributors
    // ------------------------------------------------------------------

    @Test
    void score_customContributor_addsWeightedSignal() {
        ScoringContributor seniority = contributor("seniority", 0.25, ctx -> 1.0);
        SimilarityScorer custom = new SimilarityScorer(List.of(new SkillOverlapContributor(), seniority));

        SkillScore s = custom.score(Set.of("rust"), Set.of("rust"));

        // 100 * (0.6 * 1.0 + 0.25 * 1.0)
        assertThat(s.composite()).isCloseTo(85.0, within(1e-9));
        assertThat(s.explanation()).isEqualTo("skill_jaccard=1.000 seniority=1.000");
    }

    @Test
    void score_signalOutOfRange_isClamped() {
        ScoringContributor noisy = contributor("noisy", 0.4, ctx -> 7.5);
        SimilarityScorer custom = new SimilarityScorer(List.of(new SkillOverlapContributor(), noisy));

        SkillScore s = custom.score(Set.of("rust"), Set.of("python"));

        assertThat(s.composite()).isEqualTo(40.00);
        assertThat(s.explanation()).endsWith("noisy=1.000");
    }

    @Test
    void constructor_weightsAboveOne_throws() {
        assertThatThrownBy(() -> new SimilarityScorer(List.of(
                new SkillOverlapContributor(), contributor("extra", 0.5, ctx -> 0.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit");
    }

    @Test
    void constructor_duplicateName_throws() {
        assertThatThrownBy(() -> new SimilarityScorer(List.of(
                new ExperienceContributor(), contributor("experience", 0.1, ctx -> 0.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("experience");
    }

    @Test
    void constructor_negativeWeight_throws() {
        assertThatThrownBy(() -> new SimilarityScorer(List.of(contributor("bad", -0.1, ctx -> 0.0))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultContributors_weightsAreCanonical() {
        assertThat(scorer.contributors())
                .extracting(ScoringContributor::name, ScoringContributor::weight)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("skill_jaccard", 0.60),
                        org.assertj.core.groups.Tuple.tuple("experience", 0.25),
                        org.assertj.core.groups.Tuple.tuple("other", 0.15));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ScoringContributor contributor(String name, double weight,
                                                  java.util.function.ToDoubleFunction<ScoringContext> fn) {
        return new ScoringContributor() {
            @Override public String name()   { return name; }
            @Override public double weight() { return weight; }
            @Override public double signal(ScoringContext ctx) { return fn.applyAsDouble(ctx); }
        };
    }
}
