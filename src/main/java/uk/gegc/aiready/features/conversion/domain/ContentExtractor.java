package uk.gegc.aiready.features.conversion.domain;

import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;

/**
 * Reads the bytes of one input family into format-neutral structured content.
 * Strategy pattern: the dispatcher picks the first extractor that supports a file.
 */
public interface ContentExtractor {

    /**
     * Checks if this extractor supports the given filename or MIME type.
     *
     * @param filenameOrMime the filename or MIME type to check
     * @return true if this extractor can handle the format
     */
    boolean supports(String filenameOrMime);

    /**
     * Extracts structured content from the file bytes.
     *
     * @param bytes    the raw file bytes
     * @param filename the original filename, used to pick a variant of the format (e.g. legacy vs OOXML)
     * @return the extracted content
     * @throws ExtractionException if the bytes are corrupt or unreadable
     */
    StructuredContent extract(byte[] bytes, String filename) throws ExtractionException;
}
