package uk.gegc.aiready.features.session.application;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import uk.gegc.aiready.features.conversion.application.MimeTypeDetector;
import uk.gegc.aiready.features.conversion.domain.InputCategory;
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
import uk.gegc.aiready.shared.exception.ResourceNotFoundException;
import uk.gegc.aiready.util.MutableClock;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileLifecycleService Tests")
class FileLifecycleServiceTest {

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private SessionStore store;
    private FileLifecycleService service;
    private String sessionId;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T12:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        SessionProperties properties = new SessionProperties();
        properties.setMaxFileSize(DataSize.ofBytes(1_000));
        properties.setMaxSessionSize(DataSize.ofBytes(2_500));
        properties.setPreviewLength(10);
        ConversionMetrics metrics = new ConversionMetrics(meterRegistry);
        store = new SessionStore(properties, metrics, clock);
        service = new FileLifecycleService(store, new MimeTypeDetector(), properties, metrics, clock);
        sessionId = store.getOrCreate(null).id();
    }

    @Test
    @DisplayName("upload: accepted file gets an id, category and default format")
    void upload_validFile_isStored() {
        // When
        FileSnapshot snapshot = service.upload(sessionId, "sales.csv", csv(100));

        // Then
        assertThat(snapshot.id()).isNotNull();
        assertThat(snapshot.originalFilename()).isEqualTo("sales.csv");
        assertThat(snapshot.category()).isEqualTo(InputCategory.SPREADSHEET);
        assertThat(snapshot.outputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(snapshot.state()).isEqualTo(FileState.UPLOADED);
        assertThat(snapshot.sizeBytes()).isEqualTo(100);
        assertThat(snapshot.uploadedAt()).isEqualTo(clock.instant());
        assertThat(store.get(sessionId).totalBytes()).isEqualTo(100);
        assertThat(meterRegistry.get("converter.uploads.accepted").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("upload: client path segments are dropped from the name")
    void upload_pathInName_isSanitized() {
        FileSnapshot snapshot = service.upload(sessionId, "C:\\Users\\me\\report.csv", csv(10));

        assertThat(snapshot.originalFilename()).isEqualTo("report.csv");
    }

    @Test
    @DisplayName("upload: unsupported extension is rejected and nothing changes")
    void upload_unsupportedExtension_isRejected() {
        assertThatThrownBy(() -> service.upload(sessionId, "notes.txt", csv(10)))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("notes.txt");

        assertThat(service.listFiles(sessionId)).isEmpty();
        assertThat(meterRegistry.get("converter.uploads.rejected").tag("reason", "unsupported_format").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("upload: file over the per-file cap is rejected")
    void upload_tooLarge_isRejected() {
        assertThatThrownBy(() -> service.upload(sessionId, "big.csv", csv(1_001)))
                .isInstanceOf(FileTooLargeException.class)
                .satisfies(ex -> {
                    FileTooLargeException tooLarge = (FileTooLargeException) ex;
                    assertThat(tooLarge.getSizeBytes()).isEqualTo(1_001);
                    assertThat(tooLarge.getLimitBytes()).isEqualTo(1_000);
                });

        assertThat(store.get(sessionId).totalBytes()).isZero();
    }

    @Test
    @DisplayName("upload: file exactly at the cap is accepted")
    void upload_atCap_isAccepted() {
        assertThat(service.upload(sessionId, "edge.csv", csv(1_000)).sizeBytes()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("upload: session quota is enforced and the rejected file leaves no trace")
    void upload_overQuota_isRejectedAtomically() {
        // Given
        service.upload(sessionId, "a.csv", csv(1_000));
        service.upload(sessionId, "b.csv", csv(1_000));

        // When / Then
        assertThatThrownBy(() -> service.upload(sessionId, "c.csv", csv(501)))
                .isInstanceOf(SessionQuotaExceededException.class);
        assertThat(service.listFiles(sessionId)).hasSize(2);
        assertThat(store.get(sessionId).totalBytes()).isEqualTo(2_000);

        assertThat(service.upload(sessionId, "d.csv", csv(500)).sizeBytes()).isEqualTo(500);
    }

    @Test
    @DisplayName("deleteFile: frees the file's share of the quota")
    void deleteFile_freesQuota() {
        FileSnapshot first = service.upload(sessionId, "a.csv", csv(1_000));
        service.upload(sessionId, "b.csv", csv(1_000));

        service.deleteFile(sessionId, first.id());

        assertThat(store.get(sessionId).totalBytes()).isEqualTo(1_000);
        assertThat(service.upload(sessionId, "c.csv", csv(1_000))).isNotNull();
        assertThatThrownBy(() -> service.deleteFile(sessionId, first.id()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("clear: removes every file but keeps the session")
    void clear_removesAllFiles() {
        service.upload(sessionId, "a.csv", csv(10));
        service.upload(sessionId, "b.csv", csv(10));

        assertThat(service.clear(sessionId)).isEqualTo(2);
        assertThat(service.listFiles(sessionId)).isEmpty();
        assertThat(store.get(sessionId).totalBytes()).isZero();
        assertThat(service.clear(sessionId)).isZero();
    }

    @Test
    @DisplayName("setFormat: allowed while uploaded, rejected once conversion started")
    void setFormat_onlyWhileUploaded() {
        // Given
        FileSnapshot uploaded = service.upload(sessionId, "a.csv", csv(10));

        // When
        FileSnapshot changed = service.setFormat(sessionId, uploaded.id(), "md");

        // Then
        assertThat(changed.outputFormat()).isEqualTo(OutputFormat.MARKDOWN);

        markConverted(uploaded.id(), "a.md", "# a");
        assertThatThrownBy(() -> service.setFormat(sessionId, uploaded.id(), "json"))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> service.setFormat(sessionId, uploaded.id(), "xml"))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> service.setFormat(sessionId, UUID.randomUUID(), "json"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("getPreview: long output is cut at the preview length and marked")
    void getPreview_truncatesLongOutput() {
        FileSnapshot file = service.upload(sessionId, "a.csv", csv(10));
        markConverted(file.id(), "a.json", "0123456789ABCDEF");

        FilePreview preview = service.getPreview(sessionId, file.id());

        assertThat(preview.truncated()).isTrue();
        assertThat(preview.totalLength()).isEqualTo(16);
        assertThat(preview.content()).isEqualTo("0123456789" + FileLifecycleService.TRUNCATION_MARKER);
        assertThat(preview.outputFilename()).isEqualTo("a.json");
    }

    @Test
    @DisplayName("getPreview: short output is returned whole")
    void getPreview_shortOutputUntouched() {
        FileSnapshot file = service.upload(sessionId, "a.csv", csv(10));
        markConverted(file.id(), "a.json", "[]\n");

        FilePreview preview = service.getPreview(sessionId, file.id());

        assertThat(preview.truncated()).isFalse();
        assertThat(preview.content()).isEqualTo("[]\n");
    }

    @Test
    @DisplayName("getPreview: surrogate pairs are never split")
    void getPreview_keepsSurrogatePairsWhole() {
        FileSnapshot file = service.upload(sessionId, "a.csv", csv(10));
        markConverted(file.id(), "a.md", "123456789\uD83D\uDE00tail");

        FilePreview preview = service.getPreview(sessionId, file.id());

        assertThat(preview.content()).startsWith("123456789" + FileLifecycleService.TRUNCATION_MARKER);
    }

    @Test
    @DisplayName("getPreview / download: unconverted file is an invalid state")
    void previewAndDownload_requireConvertedFile() {
        FileSnapshot file = service.upload(sessionId, "a.csv", csv(10));

        assertThatThrownBy(() -> service.getPreview(sessionId, file.id()))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> service.download(sessionId, file.id()))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("download: returns UTF-8 bytes, output name and media type")
    void download_returnsOutput() {
        FileSnapshot file = service.upload(sessionId, "a.csv", csv(10));
        service.setFormat(sessionId, file.id(), OutputFormat.MARKDOWN);
        markConverted(file.id(), "a.md", "# café\n");

        DownloadedFile download = service.download(sessionId, file.id());

        assertThat(download.filename()).isEqualTo("a.md");
        assertThat(download.mediaType()).isEqualTo("text/markdown");
        assertThat(new String(download.content(), StandardCharsets.UTF_8)).isEqualTo("# café\n");
    }

    @Test
    void sanitizeFilename_fallsBackForEmptyNames() {
        assertThat(FileLifecycleService.sanitizeFilename(null)).isEqualTo("unnamed");
        assertThat(FileLifecycleService.sanitizeFilename("dir/")).isEqualTo("unnamed");
        assertThat(FileLifecycleService.sanitizeFilename("../../etc/passwd.csv")).isEqualTo("passwd.csv");
    }

    private void markConverted(UUID fileId, String outputFilename, String text) {
        store.write(sessionId, session -> {
            FileRecord record = session.requireFile(fileId);
            record.markConverting();
            record.markConverted(outputFilename, text, clock.instant());
            return record;
        });
    }

    private static byte[] csv(int size) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, (byte) 'a');
        if (size > 1) {
            bytes[size - 1] = '\n';
        }
        return bytes;
    }
}
