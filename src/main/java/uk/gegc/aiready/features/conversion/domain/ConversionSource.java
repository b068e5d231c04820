package uk.gegc.aiready.features.conversion.domain;

/**
 * Input of a single conversion: the file as uploaded plus the requested output format.
 */
public record ConversionSource(String filename, String mimeType, byte[] bytes, OutputFormat format) {
}
