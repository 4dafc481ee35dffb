package com.skillmatch.matcher.skill;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One recognition rule in the skill catalog.
 *
 * @param name  Unique identifier of the rule within a catalog, e.g. "node.js".
 *              Only used for lookup and listing; extracted tokens are the
 *              matched text, not this name.
 * @param regex Compiled, case-insensitive, Unicode-aware pattern.
 */
public record SkillPattern(String name, Pattern regex) {

    public SkillPattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(regex, "regex");
    }

    /**
     * Compile {@code regex} case-insensitively. Character classes and
     * {@code \b} follow Unicode, so "rustä" is one word on every JDK.
     */
    public static SkillPattern of(String name, String regex) {
        return new SkillPattern(name, Pattern.compile(regex,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
    }
}
