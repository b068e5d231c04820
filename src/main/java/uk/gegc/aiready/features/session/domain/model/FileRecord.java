package uk.gegc.aiready.features.session.domain.model;

import lombok.Getter;
import uk.gegc.aiready.features.conversion.domain.ConversionSource;
import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.InvalidStateTransitionException;

import java.time.Instant;
import java.util.UUID;

/**
 * One uploaded file and its conversion outcome.
 * Not thread-safe: every access goes through the owning session's lock.
 *
 * <p>State machine: {@code UPLOADED -> CONVERTING -> CONVERTED | ERROR}, plus
 * {@code CONVERTING -> UPLOADED} when a batch is rolled back.
 */
@Getter
public class FileRecord {

    private final UUID id;
    private final String originalFilename;
    private final String extension;
    private final InputCategory category;
    private final String mimeType;
    private final long sizeBytes;
    private final Instant uploadedAt;

    private OutputFormat outputFormat;
    private FileState state;
    private String outputFilename;
    private String outputText;
    private String errorMessage;
    private Instant convertedAt;

    // Null once released
    private byte[] bytes;

    private FileRecord(UUID id, String originalFilename, String extension, InputCategory category,
                       String mimeType, byte[] bytes, Instant uploadedAt) {
        this.id = id;
        this.originalFilename = originalFilename;
        this.extension = extension;
        this.category = category;
        this.mimeType = mimeType;
        this.bytes = bytes;
        this.sizeBytes = bytes.length;
        this.uploadedAt = uploadedAt;
        this.outputFormat = category.getDefaultFormat();
        this.state = FileState.UPLOADED;
    }

    public static FileRecord uploaded(UUID id, String originalFilename, String extension, InputCategory category,
                                      String mimeType, byte[] bytes, Instant uploadedAt) {
        return new FileRecord(id, originalFilename, extension, category, mimeType, bytes, uploadedAt);
    }

    public void changeOutputFormat(OutputFormat format) {
        requireState(FileState.UPLOADED, "change the output format of");
        this.outputFormat = format;
    }

    public void markConverting() {
        requireState(FileState.UPLOADED, "start converting");
        this.state = FileState.CONVERTING;
    }

    public void markConverted(String outputFilename, String outputText, Instant convertedAt) {
        requireState(FileState.CONVERTING, "complete");
        this.state = FileState.CONVERTED;
        this.outputFilename = outputFilename;
        this.outputText = outputText;
        this.errorMessage = null;
        this.convertedAt = convertedAt;
    }

    public void markFailed(String errorMessage, Instant failedAt) {
        requireState(FileState.CONVERTING, "fail");
        this.state = FileState.ERROR;
        this.errorMessage = errorMessage;
        this.outputFilename = null;
        this.outputText = null;
        this.convertedAt = failedAt;
    }

    public void rollbackToUploaded() {
        requireState(FileState.CONVERTING, "roll back");
        this.state = FileState.UPLOADED;
    }

    /**
     * Drops the raw bytes. Returns {@code false} when they were already released.
     */
    public boolean release() {
        if (bytes == null) {
            return false;
        }
        bytes = null;
        return true;
    }

    public boolean isReleased() {
        return bytes == null;
    }

    public ConversionSource toConversionSource() {
        if (bytes == null) {
            throw new IllegalStateException("Content of file " + id + " has been released");
        }
        return new ConversionSource(originalFilename, mimeType, bytes, outputFormat);
    }

    public FileSnapshot snapshot() {
        return new FileSnapshot(id, originalFilename, extension, category, mimeType, sizeBytes, outputFormat,
                state, outputFilename, errorMessage, uploadedAt, convertedAt);
    }

    private void requireState(FileState expected, String action) {
        if (state != expected) {
            throw new InvalidStateTransitionException(
                    "Cannot " + action + " file '" + originalFilename + "' in state " + state.getValue());
        }
    }
}
