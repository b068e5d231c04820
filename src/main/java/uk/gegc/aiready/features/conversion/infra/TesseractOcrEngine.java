package uk.gegc.aiready.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.config.OcrProperties;
import uk.gegc.aiready.features.conversion.domain.OcrEngine;
import uk.gegc.aiready.features.conversion.domain.OcrException;

import java.awt.image.BufferedImage;

/**
 * OCR engine backed by Tesseract through Tess4J.
 * A new {@link Tesseract} instance is created per call because instances are not thread-safe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private final OcrProperties properties;

    @Override
    public String recognize(BufferedImage image) throws OcrException {
        Tesseract tesseract = new Tesseract();
        if (properties.getDatapath() != null && !properties.getDatapath().isBlank()) {
            tesseract.setDatapath(properties.getDatapath());
        }
        tesseract.setLanguage(properties.getLanguage());
        try {
            String text = tesseract.doOCR(image);
            return text == null ? "" : text.replace("\r\n", "\n").trim();
        } catch (TesseractException e) {
            throw new OcrException("OCR failed: " + e.getMessage(), e);
        } catch (LinkageError | RuntimeException e) {
            // Native library missing or tessdata not found
            log.warn("Tesseract is not available: {}", e.toString());
            throw new OcrException("OCR not available: " + e.getMessage(), e);
        }
    }
}
