package com.skillmatch.matcher.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One job the candidate is matched against.
 *
 * @param requiredSkills Skills declared by the poster, as written. May be null.
 */
public record JobPosting(
        String             id,
        String             title,
        String             description,
        Collection<String> requiredSkills) {

    /**
     * Declared skills normalised to skill tokens: trimmed, lower-cased,
     * blanks dropped.
     */
    public SortedSet<String> normalizedRequiredSkills() {
        SortedSet<String> out = new TreeSet<>();
        if (requiredSkills != null) {
            requiredSkills.stream()
                    .filter(Objects::nonNull)
                    .map(s -> s.strip().toLowerCase(Locale.ROOT))
                    .filter(s -> !s.isEmpty())
                    .forEach(out::add);
        }
        return Collections.unmodifiableSortedSet(out);
    }
}
