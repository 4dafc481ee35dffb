package com.skillmatch.matcher.api.dto;

/**
 * Error body for rejected requests.
 *
 * @param error      "validation_failed" or "extraction_failed"
 * @param constraint Violated field for validation errors; null otherwise.
 */
public record ErrorResponse(String error, String constraint, String message) {}
