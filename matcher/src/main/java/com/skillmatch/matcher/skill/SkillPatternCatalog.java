package com.skillmatch.matcher.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable list of {@link SkillPattern}s the extractor scans text with.
 *
 * <p>{@link #DEFAULT} is built once during class initialization and shared by
 * every request thread without synchronization; nothing can add or remove
 * patterns afterwards.
 */
public final class SkillPatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(SkillPatternCatalog.class);

    public static final SkillPatternCatalog DEFAULT = new SkillPatternCatalog(List.of(
            SkillPattern.of("rust",                        "rust\\b"),
            SkillPattern.of("c++",                         "c\\+\\+"),
            SkillPattern.of("python",                      "python\\b"),
            SkillPattern.of("java",                        "java\\b"),
            SkillPattern.of("sql",                         "sql\\b"),
            SkillPattern.of("postgresql",                  "postgresql\\b"),
            SkillPattern.of("docker",                      "docker\\b"),
            SkillPattern.of("kubernetes",                  "kubernetes\\b"),
            SkillPattern.of("linux",                       "linux\\b"),
            SkillPattern.of("html",                        "html\\b"),
            SkillPattern.of("css",                         "css\\b"),
            SkillPattern.of("javascript",                  "javascript\\b"),
            SkillPattern.of("react",                       "react\\b"),
            SkillPattern.of("node.js",                     "node\\.?js\\b"),
            SkillPattern.of("nlp",                         "nlp\\b"),
            SkillPattern.of("natural language processing", "natural language processing\\b")
    ));

    private final List<SkillPattern> patterns;

    /**
     * @throws IllegalArgumentException if two patterns share a name
     */
    public SkillPatternCatalog(List<SkillPattern> patterns) {
        Set<String> seen = new HashSet<>();
        for (SkillPattern p : patterns) {
            if (!seen.add(p.name())) {
                throw new IllegalArgumentException("Duplicate skill pattern name: '" + p.name() + "'");
            }
        }
        this.patterns = List.copyOf(patterns);
        log.debug("Skill catalog initialised with {} patterns", this.patterns.size());
    }

    public List<SkillPattern> patterns() {
        return patterns;
    }

    /** Returns all pattern names (sorted). */
    public List<String> skillNames() {
        return patterns.stream().map(SkillPattern::name).sorted().toList();
    }

    public int size() {
        return patterns.size();
    }
}
