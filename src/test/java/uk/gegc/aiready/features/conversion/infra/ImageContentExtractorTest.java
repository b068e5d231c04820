package uk.gegc.aiready.features.conversion.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.OcrEngine;
import uk.gegc.aiready.features.conversion.domain.OcrException;
import uk.gegc.aiready.features.conversion.domain.model.ImageContent;
import uk.gegc.aiready.util.TestFiles;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImageContentExtractor Tests")
class ImageContentExtractorTest {

    @Mock
    private OcrEngine ocrEngine;

    @InjectMocks
    private ImageContentExtractor extractor;

    @Test
    void supports_acceptsImageExtensionsAndMimeTypes() {
        assertThat(extractor.supports("scan.png")).isTrue();
        assertThat(extractor.supports("photo.JPEG")).isTrue();
        assertThat(extractor.supports("fax.tiff")).isTrue();
        assertThat(extractor.supports("image/gif")).isTrue();
        assertThat(extractor.supports("vector.svg")).isFalse();
        assertThat(extractor.supports(null)).isFalse();
    }

    @Test
    @DisplayName("extract: png keeps dimensions, OCR text and the original bytes as base64")
    void extract_png_returnsImageContent() throws Exception {
        // Given
        byte[] png = TestFiles.png(40, 20);
        when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn("INVOICE 42");

        // When
        ImageContent content = (ImageContent) extractor.extract(png, "scan.png");

        // Then
        assertThat(content.format()).isEqualTo("PNG");
        assertThat(content.mimeType()).isEqualTo("image/png");
        assertThat(content.width()).isEqualTo(40);
        assertThat(content.height()).isEqualTo(20);
        assertThat(content.ocrText()).isEqualTo("INVOICE 42");
        assertThat(Base64.getDecoder().decode(content.base64Data())).isEqualTo(png);
        assertThat(content.dataUri()).startsWith("data:image/png;base64,");
    }

    @Test
    @DisplayName("extract: image declaring huge dimensions is rejected before decoding")
    void extract_hugeDeclaredDimensions_throwsExtractionException() throws Exception {
        // Given
        byte[] png = TestFiles.pngDeclaring(20_000, 20_000);

        // When / Then
        assertThatThrownBy(() -> extractor.extract(png, "poster.png"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("too large")
                .hasMessageContaining("20000x20000");
        verify(ocrEngine, never()).recognize(any());
    }

    @Test
    @DisplayName("extract: OCR receives an opaque RGB image")
    void extract_transparentPng_ocrSeesRgb() throws Exception {
        when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn("");

        extractor.extract(TestFiles.png(8, 8), "alpha.png");

        verify(ocrEngine).recognize(argThat(image -> image.getType() == BufferedImage.TYPE_INT_RGB));
    }

    @Test
    @DisplayName("extract: jpg is reported as JPEG regardless of the filename")
    void extract_jpeg_normalizesFormat() throws Exception {
        when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn(null);

        ImageContent content = (ImageContent) extractor.extract(TestFiles.jpeg(16, 16), "photo.jpg");

        assertThat(content.format()).isEqualTo("JPEG");
        assertThat(content.mimeType()).isEqualTo("image/jpeg");
        assertThat(content.ocrText()).isEmpty();
    }

    @Test
    @DisplayName("extract: OCR failure becomes an ExtractionException for this file")
    void extract_ocrFailure_throwsExtractionException() throws Exception {
        when(ocrEngine.recognize(any(BufferedImage.class))).thenThrow(new OcrException("OCR not available: no tessdata"));

        assertThatThrownBy(() -> extractor.extract(TestFiles.png(4, 4), "scan.png"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Failed to extract text from image")
                .hasMessageContaining("no tessdata");
    }

    @Test
    @DisplayName("extract: undecodable bytes fail before OCR runs")
    void extract_corruptImage_throwsExtractionException() throws Exception {
        byte[] garbage = "not an image".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(garbage, "broken.png"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Failed to read image");
        verify(ocrEngine, never()).recognize(any());
    }
}
