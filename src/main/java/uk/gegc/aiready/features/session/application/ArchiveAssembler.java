package uk.gegc.aiready.features.session.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.NothingToArchiveException;
import uk.gegc.aiready.features.session.domain.model.FileRecord;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Bundles a session's converted outputs into one ZIP archive.
 * Entries are ordered by conversion time, then file id, and stamped with their conversion time, so an
 * unchanged session always yields the same bytes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveAssembler {

    public static final String ARCHIVE_FILENAME = "converted_files.zip";

    private final SessionStore sessionStore;
    private final ConversionMetrics metrics;

    /**
     * @throws NothingToArchiveException if the session has no converted files
     */
    public byte[] buildArchive(String sessionId) {
        return sessionStore.write(sessionId, session -> {
            List<FileRecord> converted = session.files().stream()
                    .filter(record -> record.getState() == FileState.CONVERTED)
                    .sorted(Comparator.comparing(FileRecord::getConvertedAt).thenComparing(FileRecord::getId))
                    .toList();
            if (converted.isEmpty()) {
                throw new NothingToArchiveException("No converted files to download");
            }

            byte[] archive = writeZip(converted);
            metrics.recordArchiveBuilt();
            log.info("Built archive of {} files ({} bytes) for session {}",
                    converted.size(), archive.length, session.getId());
            return archive;
        });
    }

    private byte[] writeZip(List<FileRecord> records) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            for (FileRecord record : records) {
                ZipEntry entry = new ZipEntry(record.getOutputFilename());
                entry.setTime(record.getConvertedAt().toEpochMilli());
                zip.putNextEntry(entry);
                zip.write(record.getOutputText().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write archive", e);
        }
        return buffer.toByteArray();
    }
}
