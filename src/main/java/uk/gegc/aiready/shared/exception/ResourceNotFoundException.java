package uk.gegc.aiready.shared.exception;

/**
 * Exception thrown when a requested session or file does not exist
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
