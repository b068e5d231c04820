package uk.gegc.aiready.features.conversion.domain;

/**
 * Exception thrown when a file type or output format is not handled by any extractor or serializer.
 */
public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
