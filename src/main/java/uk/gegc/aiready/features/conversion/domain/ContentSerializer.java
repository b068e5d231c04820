package uk.gegc.aiready.features.conversion.domain;

import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;

/**
 * Renders structured content into one output format. Implementations must be deterministic:
 * the same content always renders to the same text.
 */
public interface ContentSerializer {

    OutputFormat format();

    String serialize(String filename, StructuredContent content);
}
