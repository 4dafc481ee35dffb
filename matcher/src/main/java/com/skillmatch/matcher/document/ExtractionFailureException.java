package com.skillmatch.matcher.document;

/**
 * Thrown when an uploaded document cannot be turned into text: corrupt PDF,
 * unreadable upload, or bytes that are not valid UTF-8.
 */
public class ExtractionFailureException extends RuntimeException {

    private final String fileName;

    public ExtractionFailureException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public ExtractionFailureException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() { return fileName; }
}
