package uk.gegc.aiready.features.session.domain.model;

import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.session.domain.FileState;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable copy of a file record's metadata, without bytes or output text.
 */
public record FileSnapshot(
        UUID id,
        String originalFilename,
        String extension,
        InputCategory category,
        String mimeType,
        long sizeBytes,
        OutputFormat outputFormat,
        FileState state,
        String outputFilename,
        String errorMessage,
        Instant uploadedAt,
        Instant convertedAt
) {
}
