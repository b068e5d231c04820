package uk.gegc.aiready.features.conversion.domain;

/**
 * Result of a successful conversion. The output filename is the base candidate; the caller
 * resolves collisions with other files.
 */
public record RenderedOutput(String outputFilename, OutputFormat format, String text) {
}
