package uk.gegc.aiready.features.session.domain;

/**
 * Exception thrown when an operation is not allowed in the file's current state
 */
public class InvalidStateTransitionException extends RuntimeException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
