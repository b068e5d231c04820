package uk.gegc.aiready.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.session.domain.model.FilePreview;

import java.util.UUID;

@Schema(name = "PreviewResponse", description = "Leading part of a converted file")
public record PreviewResponse(
    UUID fileId,
    @Schema(example = "report.md") String outputFilename,
    @Schema(example = "markdown") OutputFormat format,
    @Schema(description = "Output text, cut and marked when longer than the preview length") String content,
    @Schema(description = "Length of the full output in characters", example = "5120") int totalLength,
    boolean truncated
) {

    public static PreviewResponse from(FilePreview preview) {
        return new PreviewResponse(
                preview.fileId(),
                preview.outputFilename(),
                preview.format(),
                preview.content(),
                preview.totalLength(),
                preview.truncated()
        );
    }
}
