package uk.gegc.aiready.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.session.domain.FileState;
import uk.gegc.aiready.features.session.domain.model.FileSnapshot;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "FileView", description = "Uploaded file and its conversion status")
public record FileView(
    @Schema(description = "File UUID, unique within the session")
    UUID id,

    @Schema(description = "Original filename", example = "sales.xlsx")
    String filename,

    @Schema(description = "Lower-cased extension", example = ".xlsx")
    String extension,

    @Schema(description = "Input category", example = "spreadsheet")
    InputCategory category,

    @Schema(description = "Detected MIME type", example = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")
    String mimeType,

    @Schema(description = "Size in bytes", example = "2097152")
    long sizeBytes,

    @Schema(description = "Requested output format", example = "json")
    OutputFormat outputFormat,

    @Schema(description = "Conversion state", example = "uploaded")
    FileState state,

    @Schema(description = "Output filename once converted", example = "sales.json")
    String outputFilename,

    @Schema(description = "Error message when conversion failed")
    String error,

    @Schema(description = "Upload timestamp")
    Instant uploadedAt,

    @Schema(description = "Conversion completion timestamp")
    Instant convertedAt
) {

    public static FileView from(FileSnapshot snapshot) {
        return new FileView(
                snapshot.id(),
                snapshot.originalFilename(),
                snapshot.extension(),
                snapshot.category(),
                snapshot.mimeType(),
                snapshot.sizeBytes(),
                snapshot.outputFormat(),
                snapshot.state(),
                snapshot.outputFilename(),
                snapshot.errorMessage(),
                snapshot.uploadedAt(),
                snapshot.convertedAt()
        );
    }
}
