package uk.gegc.aiready.features.session.domain.model;

import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.session.domain.FileState;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one file in a batch conversion. Exactly one of {@code outputFilename} and {@code error} is set.
 */
public record ConversionResult(
        UUID fileId,
        String originalFilename,
        FileState state,
        OutputFormat outputFormat,
        String outputFilename,
        String error,
        Instant timestamp
) {

    public static ConversionResult of(FileRecord record) {
        return new ConversionResult(record.getId(), record.getOriginalFilename(), record.getState(),
                record.getOutputFormat(), record.getOutputFilename(), record.getErrorMessage(), record.getConvertedAt());
    }

    public boolean succeeded() {
        return state == FileState.CONVERTED;
    }
}
