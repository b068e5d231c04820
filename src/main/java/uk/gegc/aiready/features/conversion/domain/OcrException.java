package uk.gegc.aiready.features.conversion.domain;

/**
 * Exception thrown when the OCR engine cannot recognise text in an image.
 */
public class OcrException extends Exception {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
