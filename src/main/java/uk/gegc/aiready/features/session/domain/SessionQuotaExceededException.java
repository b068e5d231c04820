package uk.gegc.aiready.features.session.domain;

import lombok.Getter;

/**
 * Exception thrown when an upload would push a session's cumulative size over its cap
 */
@Getter
public class SessionQuotaExceededException extends RuntimeException {

    private final long usedBytes;
    private final long limitBytes;

    public SessionQuotaExceededException(String filename, long usedBytes, long limitBytes) {
        super("Uploading '" + filename + "' would exceed the session limit of " + limitBytes
                + " bytes (" + usedBytes + " bytes in use)");
        this.usedBytes = usedBytes;
        this.limitBytes = limitBytes;
    }
}
