package com.skillmatch.matcher.scoring;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Years-of-experience fit. Requests carry no experience data yet, so the
 * signal is always 0.0 and the weight is reserved.
 */
@Component
@Order(2)
public class ExperienceContributor implements ScoringContributor {

    public static final double WEIGHT = 0.25;

    @Override public String name()   { return "experience"; }
    @Override public double weight() { return WEIGHT; }

    @Override
    public double signal(ScoringContext ctx) {
        return 0.0;
    }
}
