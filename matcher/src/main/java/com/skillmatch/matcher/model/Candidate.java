package com.skillmatch.matcher.model;

/**
 * The person being matched. Built from a single request and discarded after
 * scoring.
 *
 * @param name    Optional display name; not used for scoring.
 * @param rawText Free-text profile (resume body, summary, ...). May be empty.
 */
public record Candidate(String name, String rawText) {}
