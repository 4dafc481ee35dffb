package com.skillmatch.matcher.config;

import com.skillmatch.matcher.skill.SkillExtractor;
import com.skillmatch.matcher.skill.SkillPatternCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring for the matching engine.
 *
 * The scoring pool is fixed-size and shared by every request.
 */
@Configuration
public class MatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(MatcherConfig.class);

    @Bean
    public SkillPatternCatalog skillPatternCatalog() {
        SkillPatternCatalog catalog = SkillPatternCatalog.DEFAULT;
        log.info("Loaded {} skill patterns: {}", catalog.size(), catalog.skillNames());
        return catalog;
    }

    @Bean
    public SkillExtractor skillExtractor(SkillPatternCatalog catalog) {
        return new SkillExtractor(catalog);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scoringPool(@Value("${skillmatch.scoring.workers:4}") int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("skillmatch.scoring.workers must be >= 1, was " + workers);
        }
        log.info("Scoring pool started with {} workers", workers);
        return Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("scoring-"));
    }
}
