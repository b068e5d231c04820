package uk.gegc.aiready.features.session.domain.model;

import uk.gegc.aiready.features.conversion.domain.OutputFormat;

import java.util.UUID;

public record FilePreview(
        UUID fileId,
        String outputFilename,
        OutputFormat format,
        String content,
        int totalLength,
        boolean truncated
) {
}
