package uk.gegc.aiready.features.conversion.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.aiready.features.conversion.application.MimeTypeDetector.DetectedType;
import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.util.TestFiles;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MimeTypeDetector Tests")
class MimeTypeDetectorTest {

    private MimeTypeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new MimeTypeDetector();
    }

    @Test
    @DisplayName("detect: known extension decides the category")
    void detect_knownExtension() throws Exception {
        Optional<DetectedType> pdf = detector.detect("report.pdf", TestFiles.pdf("Hello"));
        Optional<DetectedType> xlsx = detector.detect("Sales.XLSX", TestFiles.xlsx(new String[][]{{"a"}, {"1"}}));

        assertThat(pdf).isPresent();
        assertThat(pdf.get().category()).isEqualTo(InputCategory.DOCUMENT);
        assertThat(pdf.get().mimeType()).isEqualTo("application/pdf");
        assertThat(xlsx).isPresent();
        assertThat(xlsx.get().category()).isEqualTo(InputCategory.SPREADSHEET);
        assertThat(xlsx.get().extension()).isEqualTo(".xlsx");
    }

    @Test
    @DisplayName("detect: generic sniffed type keeps the table MIME type")
    void detect_csvKeepsTableMimeType() {
        Optional<DetectedType> csv = detector.detect("data.csv", "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));

        assertThat(csv).isPresent();
        assertThat(csv.get().category()).isEqualTo(InputCategory.SPREADSHEET);
        assertThat(csv.get().mimeType()).isEqualTo("text/csv");
    }

    @Test
    @DisplayName("detect: unsupported extension is rejected even for supported content")
    void detect_unsupportedExtension() throws Exception {
        assertThat(detector.detect("setup.exe", new byte[]{0x4d, 0x5a, 0x00})).isEmpty();
        assertThat(detector.detect("image.webp", TestFiles.png(10, 10))).isEmpty();
    }

    @Test
    @DisplayName("detect: no extension falls back to content sniffing")
    void detect_noExtension_sniffsContent() throws Exception {
        Optional<DetectedType> image = detector.detect("scan", TestFiles.png(20, 10));

        assertThat(image).isPresent();
        assertThat(image.get().category()).isEqualTo(InputCategory.IMAGE);
        assertThat(image.get().mimeType()).isEqualTo("image/png");
    }

    @Test
    @DisplayName("detect: no extension and unrecognised content is rejected")
    void detect_noExtension_unknownContent() {
        assertThat(detector.detect("notes", "just some text".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(detector.detect("empty", new byte[0])).isEmpty();
    }

    @Test
    @DisplayName("supportedExtensions: lists every supported input")
    void supportedExtensions() {
        assertThat(detector.supportedExtensions())
                .contains(".pdf", ".docx", ".doc", ".xlsx", ".xls", ".csv", ".pptx", ".ppt",
                        ".png", ".jpg", ".jpeg", ".gif", ".bmp", ".tif", ".tiff");
    }
}
