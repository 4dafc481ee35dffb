package com.skillmatch.matcher.skill;

import java.util.Collections;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Finds known skill tokens in free text.
 *
 * Every pattern of the catalog is run over the whole text; each match adds
 * the lower-cased matched substring to the result. Two patterns that match
 * overlapping text (e.g. "postgresql" and "sql") both contribute.
 *
 * Stateless apart from the immutable catalog, so one instance is shared by
 * all worker threads.
 */
public class SkillExtractor {

    private final SkillPatternCatalog catalog;

    public SkillExtractor() {
        this(SkillPatternCatalog.DEFAULT);
    }

    public SkillExtractor(SkillPatternCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Extract the set of skill tokens found in {@code text}.
     *
     * Never fails; {@code null} and empty text yield an empty set. The
     * returned set is sorted lexicographically and unmodifiable.
     */
    public SortedSet<String> extract(String text) {
        SortedSet<String> found = new TreeSet<>();
        if (text == null || text.isEmpty()) {
            return Collections.unmodifiableSortedSet(found);
        }
        for (SkillPattern pattern : catalog.patterns()) {
            Matcher m = pattern.regex().matcher(text);
            while (m.find()) {
                found.add(m.group().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSortedSet(found);
    }

    public SkillPatternCatalog catalog() {
        return catalog;
    }
}
