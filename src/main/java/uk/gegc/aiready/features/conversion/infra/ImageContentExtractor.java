package uk.gegc.aiready.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.OcrEngine;
import uk.gegc.aiready.features.conversion.domain.OcrException;
import uk.gegc.aiready.features.conversion.domain.model.ImageContent;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Raster image extractor. Decodes the image with ImageIO, runs OCR on an RGB copy and keeps the
 * original bytes as base64 under the MIME type of the decoded format.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageContentExtractor implements ContentExtractor {

    private static final List<String> EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".bmp", ".tif", ".tiff");

    private static final Map<String, String> FORMAT_TO_MIME = Map.of(
            "png", "image/png",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "bmp", "image/bmp",
            "tif", "image/tiff"
    );

    // Decoded size is checked before any pixel data is allocated
    static final long MAX_PIXELS = 40_000_000L;

    private final OcrEngine ocrEngine;

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith) || FORMAT_TO_MIME.containsValue(lower);
    }

    @Override
    public StructuredContent extract(byte[] bytes, String filename) throws ExtractionException {
        DecodedImage decoded = decode(bytes);
        BufferedImage image = decoded.image();

        String ocrText;
        try {
            String recognized = ocrEngine.recognize(toRgb(image));
            ocrText = recognized == null ? "" : recognized;
        } catch (OcrException e) {
            throw new ExtractionException("Failed to extract text from image: " + e.getMessage(), e);
        }

        log.debug("Extracted image {}: {} {}x{}, {} OCR characters",
                filename, decoded.formatName(), image.getWidth(), image.getHeight(), ocrText.length());

        return new ImageContent(
                decoded.formatName().toUpperCase(Locale.ROOT),
                decoded.mimeType(),
                image.getWidth(),
                image.getHeight(),
                ocrText,
                Base64.getEncoder().encodeToString(bytes)
        );
    }

    private DecodedImage decode(byte[] bytes) throws ExtractionException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new ExtractionException("Failed to read image: unsupported or corrupt image data");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (pixels > MAX_PIXELS) {
                    throw new ExtractionException("Image is too large to convert: "
                            + reader.getWidth(0) + "x" + reader.getHeight(0) + " pixels (limit " + MAX_PIXELS + ")");
                }
                BufferedImage image = reader.read(0);
                String formatName = normalizeFormat(reader.getFormatName());
                return new DecodedImage(image, formatName, FORMAT_TO_MIME.getOrDefault(formatName, "image/" + formatName));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read image: " + e.getMessage(), e);
        }
    }

    private static String normalizeFormat(String formatName) {
        String lower = formatName.toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "jpg", "jpeg" -> "jpeg";
            case "tiff", "tif" -> "tif";
            default -> lower;
        };
    }

    /**
     * Copies the image onto an opaque white RGB canvas; transparent areas would otherwise read as black.
     */
    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    private record DecodedImage(BufferedImage image, String formatName, String mimeType) {
    }
}
