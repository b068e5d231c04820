package uk.gegc.aiready.features.session.domain;

/**
 * Exception thrown when an archive is requested for a session without converted files
 */
public class NothingToArchiveException extends RuntimeException {

    public NothingToArchiveException(String message) {
        super(message);
    }
}
