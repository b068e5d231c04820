package uk.gegc.aiready.features.session.domain.model;

/**
 * A file ready to be sent to the client.
 */
public record DownloadedFile(String filename, String mediaType, byte[] content) {
}
