package uk.gegc.aiready.features.conversion.domain;

import java.awt.image.BufferedImage;

/**
 * Text recognition over a decoded raster image.
 */
public interface OcrEngine {

    /**
     * Recognises the text in the given image.
     *
     * @param image decoded image, already flattened to RGB
     * @return recognised text, possibly empty when the image holds no text
     * @throws OcrException if the engine is unavailable or fails on this image
     */
    String recognize(BufferedImage image) throws OcrException;
}
