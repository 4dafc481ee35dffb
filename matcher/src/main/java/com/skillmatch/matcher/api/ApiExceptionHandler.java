package com.skillmatch.matcher.api;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.skillmatch.matcher.api.dto.ErrorResponse;
import com.skillmatch.matcher.document.ExtractionFailureException;
import com.skillmatch.matcher.model.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * HTTP 400: ValidationException, body names the violated constraint
 * HTTP 400: unreadable body; a value of the wrong JSON type is named by its
 *           field path (e.g. "top_k", "jobs[0].id"), anything else by "request_body"
 * HTTP 422: ExtractionFailureException
 *
 * Anything else (including invariant violations) is left to Spring's
 * default 500 handling.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final String REQUEST_BODY = "request_body";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("validation_failed", e.getConstraint(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        String constraint = REQUEST_BODY;
        String message = "is missing or not valid JSON";
        if (e.getCause() instanceof MismatchedInputException mie) {
            String path = fieldPath(mie);
            if (!path.isEmpty()) {
                constraint = path;
                message = mie.getTargetType() == null
                        ? "has the wrong JSON type"
                        : "has the wrong JSON type, expected " + mie.getTargetType().getSimpleName();
            }
        }
        return handleValidation(new ValidationException(constraint, message));
    }

    @ExceptionHandler(ExtractionFailureException.class)
    public ResponseEntity<ErrorResponse> handleExtractionFailure(ExtractionFailureException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("extraction_failed", null, e.getMessage()));
    }

    /** Jackson reference path in the wire format's notation: {@code jobs[2].required_skills[0]}. */
    static String fieldPath(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) path.append('.');
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.toString();
    }
}
