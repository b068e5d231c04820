package uk.gegc.aiready.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.model.ConversionResult;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ConversionResultView", description = "Outcome of one file in a batch conversion")
public record ConversionResultView(
    UUID fileId,
    String filename,
    @Schema(example = "converted") FileState state,
    @Schema(example = "markdown") OutputFormat outputFormat,
    @Schema(example = "report.md") String outputFilename,
    String error,
    Instant timestamp
) {

    public static ConversionResultView from(ConversionResult result) {
        return new ConversionResultView(
                result.fileId(),
                result.originalFilename(),
                result.state(),
                result.outputFormat(),
                result.outputFilename(),
                result.error(),
                result.timestamp()
        );
    }
}
