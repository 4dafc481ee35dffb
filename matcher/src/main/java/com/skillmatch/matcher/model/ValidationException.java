package com.skillmatch.matcher.model;

/**
 * Thrown when a match request is malformed (missing candidate text, negative
 * top_k, ...). Raised before any extraction or scoring runs.
 *
 * Unchecked: the HTTP layer maps it to 400, every other caller lets it
 * propagate.
 */
public class ValidationException extends RuntimeException {

    private final String constraint;

    /**
     * @param constraint Name of the violated field or rule, e.g. "top_k" or "jobs[2].id".
     */
    public ValidationException(String constraint, String message) {
        super("[" + constraint + "] " + message);
        this.constraint = constraint;
    }

    public String getConstraint() { return constraint; }
}
