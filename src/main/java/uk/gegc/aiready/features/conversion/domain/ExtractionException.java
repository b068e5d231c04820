package uk.gegc.aiready.features.conversion.domain;

/**
 * Exception thrown when a file's bytes cannot be read into structured content.
 * The message is meant to be shown to the user as the file's error text.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
