package com.skillmatch.matcher.scoring;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Reserved slot for miscellaneous signals (location, seniority, ...). Always 0.0. */
@Component
@Order(3)
public class OtherSignalsContributor implements ScoringContributor {

    public static final double WEIGHT = 0.15;

    @Override public String name()   { return "other"; }
    @Override public double weight() { return WEIGHT; }

    @Override
    public double signal(ScoringContext ctx) {
        return 0.0;
    }
}
