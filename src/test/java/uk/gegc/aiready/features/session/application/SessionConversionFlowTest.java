package uk.gegc.aiready.features.session.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.aiready.features.conversion.application.ConversionDispatcher;
import uk.gegc.aiready.features.conversion.application.MimeTypeDetector;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ContentSerializer;
import uk.gegc.aiready.features.conversion.domain.OcrEngine;
import uk.gegc.aiready.features.conversion.domain.OcrException;
import uk.gegc.aiready.features.conversion.infra.ImageContentExtractor;
import uk.gegc.aiready.features.conversion.infra.JsonContentSerializer;
import uk.gegc.aiready.features.conversion.infra.MarkdownContentSerializer;
import uk.gegc.aiready.features.conversion.infra.PdfBoxContentExtractor;
import uk.gegc.aiready.features.conversion.infra.PresentationContentExtractor;
import uk.gegc.aiready.features.conversion.infra.SpreadsheetContentExtractor;
import uk.gegc.aiready.features.conversion.infra.WordContentExtractor;
import uk.gegc.aiready.features.session.application.scheduler.SessionExpiryScheduler;
import uk.gegc.aiready.features.session.config.SessionProperties;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.model.ConversionResult;
import uk.gegc.aiready.features.session.domain.model.DownloadedFile;
import uk.gegc.aiready.features.session.domain.model.FileRecord;
import uk.gegc.aiready.features.session.domain.model.FileSnapshot;
import uk.gegc.aiready.shared.exception.ResourceNotFoundException;
import uk.gegc.aiready.util.MutableClock;
import uk.gegc.aiready.util.TestFiles;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Upload, conversion, archive and expiry running on the real extractors, serializers and session store.
 * Only the OCR engine is replaced.
 */
@DisplayName("Session conversion flow Tests")
class SessionConversionFlowTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private SessionStore store;
    private FileLifecycleService lifecycle;
    private BatchConversionService batch;
    private ArchiveAssembler archiveAssembler;
    private SessionExpiryScheduler scheduler;
    private ExecutorService conversionPool;
    private ExecutorService callers;
    private OcrEngine ocr;
    private String sessionId;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T12:00:00Z");
        SessionProperties properties = new SessionProperties();
        ConversionMetrics metrics = new ConversionMetrics(new SimpleMeterRegistry());
        store = new SessionStore(properties, metrics, clock);
        lifecycle = new FileLifecycleService(store, new MimeTypeDetector(), properties, metrics, clock);

        ocr = image -> "INVOICE 42";
        OcrEngine delegatingOcr = image -> ocr.recognize(image);
        List<ContentExtractor> extractors = List.of(
                new PdfBoxContentExtractor(),
                new WordContentExtractor(),
                new SpreadsheetContentExtractor(),
                new PresentationContentExtractor(),
                new ImageContentExtractor(delegatingOcr));
        List<ContentSerializer> serializers = List.of(
                new MarkdownContentSerializer(),
                new JsonContentSerializer(objectMapper));

        conversionPool = Executors.newFixedThreadPool(2);
        callers = Executors.newFixedThreadPool(2);
        batch = new BatchConversionService(store, new ConversionDispatcher(extractors, serializers),
                conversionPool, metrics, clock);
        archiveAssembler = new ArchiveAssembler(store, metrics);
        scheduler = new SessionExpiryScheduler(store);
        sessionId = store.getOrCreate(null).id();
    }

    @AfterEach
    void tearDown() {
        conversionPool.shutdownNow();
        callers.shutdownNow();
    }

    @Test
    @DisplayName("convertAll: a corrupt file fails on its own while the others convert")
    void convertAll_corruptFile_failsAlone() throws Exception {
        // Given
        byte[] docx = TestFiles.docx();
        lifecycle.upload(sessionId, "report.pdf", TestFiles.pdf("Annual summary"));
        lifecycle.upload(sessionId, "broken.docx", Arrays.copyOf(docx, docx.length / 2));
        lifecycle.upload(sessionId, "sales.xlsx", TestFiles.xlsx(new String[][]{{"Product", "Units"}, {"Widget", "3"}}));

        // When
        List<ConversionResult> results = batch.convertAll(sessionId);

        // Then
        assertThat(results).extracting(ConversionResult::originalFilename)
                .containsExactly("report.pdf", "broken.docx", "sales.xlsx");
        assertThat(results).extracting(ConversionResult::state)
                .containsExactly(FileState.CONVERTED, FileState.ERROR, FileState.CONVERTED);
        assertThat(results.get(1).error()).isNotBlank();
        assertThat(results.get(1).outputFilename()).isNull();

        JsonNode sales = objectMapper.readTree(download("sales.xlsx").content());
        assertThat(sales.isArray()).isTrue();
        assertThat(sales.get(0).get("Product").asText()).isEqualTo("Widget");
        assertThat(new String(download("report.pdf").content(), StandardCharsets.UTF_8)).contains("Annual summary");
    }

    @Test
    @DisplayName("buildArchive: three converted uploads give exactly three entries")
    void buildArchive_afterConvertAll_holdsEveryOutput() throws Exception {
        // Given
        lifecycle.upload(sessionId, "report.pdf", TestFiles.pdf("Annual summary"));
        lifecycle.upload(sessionId, "sales.xlsx", TestFiles.xlsx(new String[][]{{"Product", "Units"}, {"Widget", "3"}}));
        lifecycle.upload(sessionId, "deck.pptx", TestFiles.pptx());
        batch.convertAll(sessionId);

        // When
        byte[] archive = archiveAssembler.buildArchive(sessionId);

        // Then
        List<String> names = entryNames(archive);
        assertThat(names).hasSize(3).containsExactlyInAnyOrder("report.md", "sales.json", "deck.md");
        assertThat(archiveAssembler.buildArchive(sessionId)).isEqualTo(archive);
    }

    @Test
    @DisplayName("convertAll: scan.png renders OCR text and the base64 image as JSON")
    void convertAll_scannedImage_rendersOcrAndImage() throws Exception {
        // Given
        byte[] png = TestFiles.png(60, 30);
        FileSnapshot uploaded = lifecycle.upload(sessionId, "scan.png", png);

        // When
        List<ConversionResult> results = batch.convertAll(sessionId);

        // Then
        assertThat(uploaded.outputFormat().getValue()).isEqualTo("json");
        assertThat(results).singleElement()
                .satisfies(result -> {
                    assertThat(result.state()).isEqualTo(FileState.CONVERTED);
                    assertThat(result.outputFilename()).isEqualTo("scan.json");
                });
        JsonNode root = objectMapper.readTree(download("scan.png").content());
        assertThat(root.get("ocrText").asText()).isEqualTo("INVOICE 42");
        assertThat(root.get("image").get("base64").asText()).isNotEmpty();
        assertThat(root.get("image").get("width").asInt()).isEqualTo(60);
    }

    @Test
    @DisplayName("convertAll: OCR failure on one image leaves the sibling converted")
    void convertAll_ocrFailure_isolated() throws Exception {
        // Given
        ocr = image -> {
            throw new OcrException("Tesseract data not found");
        };
        lifecycle.upload(sessionId, "scan.png", TestFiles.png(20, 20));
        lifecycle.upload(sessionId, "notes.csv", "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));

        // When
        List<ConversionResult> results = batch.convertAll(sessionId);

        // Then
        assertThat(results).extracting(ConversionResult::state)
                .containsExactly(FileState.ERROR, FileState.CONVERTED);
        assertThat(results.get(0).error()).contains("Tesseract data not found");
    }

    @Test
    @DisplayName("sweepIdleSessions: idle session is removed and its bytes released")
    void sweep_idleSession_isDeletedAndReleased() throws Exception {
        // Given
        lifecycle.upload(sessionId, "sales.csv", "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));
        FileRecord record = store.read(sessionId, session -> session.files().iterator().next());
        clock.advance(Duration.ofMinutes(16));

        // When
        scheduler.sweepIdleSessions();

        // Then
        assertThat(store.size()).isZero();
        assertThat(record.isReleased()).isTrue();
        assertThatThrownBy(() -> store.get(sessionId)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("sweepIdleSessions: activity inside the TTL keeps the session")
    void sweep_recentlyUsedSession_survives() throws Exception {
        lifecycle.upload(sessionId, "sales.csv", "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));
        clock.advance(Duration.ofMinutes(10));
        lifecycle.listFiles(sessionId);
        clock.advance(Duration.ofMinutes(10));

        scheduler.sweepIdleSessions();

        assertThat(store.get(sessionId).files()).hasSize(1);
    }

    @Test
    @DisplayName("clear: waits for a running batch and then removes the converted files")
    void clear_duringConvertAll_runsAfterBatch() throws Exception {
        // Given
        CountDownLatch ocrStarted = new CountDownLatch(1);
        CountDownLatch releaseOcr = new CountDownLatch(1);
        ocr = image -> {
            ocrStarted.countDown();
            awaitQuietly(releaseOcr);
            return "SLOW SCAN";
        };
        lifecycle.upload(sessionId, "scan.png", TestFiles.png(20, 20));
        lifecycle.upload(sessionId, "sales.csv", "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));

        // When
        CompletableFuture<List<ConversionResult>> converting =
                CompletableFuture.supplyAsync(() -> batch.convertAll(sessionId), callers);
        assertThat(ocrStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Integer> clearing =
                CompletableFuture.supplyAsync(() -> lifecycle.clear(sessionId), callers);
        Thread.sleep(100);
        assertThat(clearing).isNotDone();
        releaseOcr.countDown();

        // Then
        List<ConversionResult> results = converting.get(5, TimeUnit.SECONDS);
        assertThat(results).extracting(ConversionResult::state)
                .containsExactly(FileState.CONVERTED, FileState.CONVERTED);
        assertThat(clearing.get(5, TimeUnit.SECONDS)).isEqualTo(2);
        assertThat(lifecycle.listFiles(sessionId)).isEmpty();
    }

    private DownloadedFile download(String originalFilename) {
        FileSnapshot file = lifecycle.listFiles(sessionId).stream()
                .filter(snapshot -> snapshot.originalFilename().equals(originalFilename))
                .findFirst()
                .orElseThrow();
        return lifecycle.download(sessionId, file.id());
    }

    private static List<String> entryNames(byte[] archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }

    private static void awaitQuietly(CountDownLatch latch) throws OcrException {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new OcrException("Timed out waiting to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcrException("Interrupted", e);
        }
    }
}
