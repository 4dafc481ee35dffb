package com.skillmatch.matcher.scoring;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Skill-set overlap; the only signal with real data today. */
@Component
@Order(1)
public class SkillOverlapContributor implements ScoringContributor {

    public static final String NAME   = "skill_jaccard";
    public static final double WEIGHT = 0.60;

    @Override public String name()   { return NAME; }
    @Override public double weight() { return WEIGHT; }

    @Override
    public double signal(ScoringContext ctx) {
        return ctx.skillSimilarity();
    }
}
