package uk.gegc.aiready.features.session.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aiready.features.conversion.application.MimeTypeDetector;
import uk.gegc.aiready.features.conversion.application.MimeTypeDetector.DetectedType;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.aiready.features.session.config.SessionProperties;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.FileTooLargeException;
import uk.gegc.aiready.features.session.domain.InvalidStateTransitionException;
import uk.gegc.aiready.features.session.domain.SessionQuotaExceededException;
import uk.gegc.aiready.features.session.domain.model.DownloadedFile;
import uk.gegc.aiready.features.session.domain.model.FilePreview;
import uk.gegc.aiready.features.session.domain.model.FileRecord;
import uk.gegc.aiready.features.session.domain.model.FileSnapshot;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Upload validation and per-file operations within a session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileLifecycleService {

    static final String TRUNCATION_MARKER = "\n\n... [truncated]";
    private static final String UNNAMED_FILE = "unnamed";

    private final SessionStore sessionStore;
    private final MimeTypeDetector mimeTypeDetector;
    private final SessionProperties properties;
    private final ConversionMetrics metrics;
    private final Clock clock;

    /**
     * Validates and stores an upload. Checks run in order (supported type, per-file cap, session quota)
     * and nothing changes when one fails.
     *
     * @throws UnsupportedFormatException     if the file is not a supported input
     * @throws FileTooLargeException          if the file exceeds the per-file cap
     * @throws SessionQuotaExceededException  if the session would exceed its cap
     */
    public FileSnapshot upload(String sessionId, String filename, byte[] content) {
        String name = sanitizeFilename(filename);
        byte[] bytes = content == null ? new byte[0] : content;

        DetectedType type = mimeTypeDetector.detect(name, bytes).orElse(null);
        if (type == null) {
            metrics.recordUploadRejected("unsupported_format");
            log.warn("Rejected upload '{}': unsupported file type", name);
            throw new UnsupportedFormatException("Unsupported file type: " + name
                    + ". Supported extensions: " + String.join(", ", mimeTypeDetector.supportedExtensions()));
        }

        long fileLimit = properties.getMaxFileSize().toBytes();
        if (bytes.length > fileLimit) {
            metrics.recordUploadRejected("file_too_large");
            log.warn("Rejected upload '{}': {} bytes exceeds the {} byte limit", name, bytes.length, fileLimit);
            throw new FileTooLargeException(name, bytes.length, fileLimit);
        }

        return sessionStore.write(sessionId, session -> {
            long sessionLimit = properties.getMaxSessionSize().toBytes();
            if (session.getTotalBytes() + bytes.length > sessionLimit) {
                metrics.recordUploadRejected("session_quota");
                log.warn("Rejected upload '{}' in session {}: quota exhausted ({} of {} bytes used)",
                        name, session.getId(), session.getTotalBytes(), sessionLimit);
                throw new SessionQuotaExceededException(name, session.getTotalBytes(), sessionLimit);
            }

            FileRecord record = FileRecord.uploaded(UUID.randomUUID(), name, type.extension(), type.category(),
                    type.mimeType(), bytes, clock.instant());
            session.addFile(record);
            metrics.recordUploadAccepted();
            log.info("Accepted '{}' ({} bytes, {}) in session {} as file {}",
                    name, bytes.length, type.category().getValue(), session.getId(), record.getId());
            return record.snapshot();
        });
    }

    /**
     * Changes the requested output format of a file that has not been converted yet.
     *
     * @throws UnsupportedFormatException      if {@code format} is not markdown, md or json
     * @throws InvalidStateTransitionException if the file is no longer in the uploaded state
     */
    public FileSnapshot setFormat(String sessionId, UUID fileId, String format) {
        return setFormat(sessionId, fileId, OutputFormat.fromValue(format));
    }

    public FileSnapshot setFormat(String sessionId, UUID fileId, OutputFormat format) {
        return sessionStore.write(sessionId, session -> {
            FileRecord record = session.requireFile(fileId);
            record.changeOutputFormat(format);
            log.debug("File {} in session {} will be converted to {}", fileId, session.getId(), format.getValue());
            return record.snapshot();
        });
    }

    public void deleteFile(String sessionId, UUID fileId) {
        sessionStore.write(sessionId, session -> {
            FileRecord removed = session.removeFile(fileId);
            log.info("Deleted file {} ('{}') from session {}", fileId, removed.getOriginalFilename(), session.getId());
            return removed;
        });
    }

    /**
     * Removes every file from the session; the session itself stays.
     *
     * @return the number of files removed
     */
    public int clear(String sessionId) {
        return sessionStore.write(sessionId, session -> {
            int removed = session.clearFiles();
            log.info("Cleared {} files from session {}", removed, session.getId());
            return removed;
        });
    }

    public List<FileSnapshot> listFiles(String sessionId) {
        return sessionStore.read(sessionId, session -> session.snapshot().files());
    }

    /**
     * First {@code previewLength} characters of the converted output, with a truncation marker when cut.
     */
    public FilePreview getPreview(String sessionId, UUID fileId) {
        return sessionStore.read(sessionId, session -> {
            FileRecord record = requireConverted(session.requireFile(fileId));
            String text = record.getOutputText();
            int limit = properties.getPreviewLength();
            if (text.length() <= limit) {
                return new FilePreview(fileId, record.getOutputFilename(), record.getOutputFormat(), text,
                        text.length(), false);
            }
            int cut = Character.isHighSurrogate(text.charAt(limit - 1)) ? limit - 1 : limit;
            return new FilePreview(fileId, record.getOutputFilename(), record.getOutputFormat(),
                    text.substring(0, cut) + TRUNCATION_MARKER, text.length(), true);
        });
    }

    public DownloadedFile download(String sessionId, UUID fileId) {
        return sessionStore.read(sessionId, session -> {
            FileRecord record = requireConverted(session.requireFile(fileId));
            return new DownloadedFile(record.getOutputFilename(), record.getOutputFormat().getMediaType(),
                    record.getOutputText().getBytes(StandardCharsets.UTF_8));
        });
    }

    private static FileRecord requireConverted(FileRecord record) {
        if (record.getState() != FileState.CONVERTED) {
            throw new InvalidStateTransitionException("File '" + record.getOriginalFilename()
                    + "' has not been converted (state: " + record.getState().getValue() + ")");
        }
        return record;
    }

    /**
     * Keeps the last path segment of a client-supplied name.
     */
    static String sanitizeFilename(String filename) {
        if (filename == null) {
            return UNNAMED_FILE;
        }
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replaceAll("\\p{Cntrl}", "").trim();
        return name.isEmpty() ? UNNAMED_FILE : name;
    }
}
