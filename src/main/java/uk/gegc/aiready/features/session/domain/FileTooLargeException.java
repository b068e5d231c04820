package uk.gegc.aiready.features.session.domain;

import lombok.Getter;

/**
 * Exception thrown when a single upload exceeds the per-file size cap
 */
@Getter
public class FileTooLargeException extends RuntimeException {

    private final long sizeBytes;
    private final long limitBytes;

    public FileTooLargeException(String filename, long sizeBytes, long limitBytes) {
        super("File '" + filename + "' is " + sizeBytes + " bytes, the limit is " + limitBytes + " bytes");
        this.sizeBytes = sizeBytes;
        this.limitBytes = limitBytes;
    }
}
