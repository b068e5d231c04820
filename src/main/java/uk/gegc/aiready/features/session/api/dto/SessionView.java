package uk.gegc.aiready.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "SessionView", description = "Current session, its files and the service limits")
public record SessionView(
    @Schema(description = "Session id, also set in the session_id cookie")
    String sessionId,

    @Schema(description = "Files in upload order")
    List<FileView> files,

    @Schema(description = "Bytes currently held by the session", example = "1048576")
    long totalBytes,

    @Schema(description = "Accepted file extensions", example = "[\".pdf\", \".docx\"]")
    List<String> supportedExtensions,

    @Schema(description = "Largest single upload in bytes", example = "10485760")
    long maxFileSizeBytes,

    @Schema(description = "Largest cumulative session size in bytes", example = "52428800")
    long maxSessionSizeBytes,

    @Schema(description = "Idle time before the session expires, in seconds", example = "900")
    long ttlSeconds
) {}
