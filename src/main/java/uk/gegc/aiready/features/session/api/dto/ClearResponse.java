package uk.gegc.aiready.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ClearResponse")
public record ClearResponse(
    @Schema(description = "Number of files removed", example = "4") int removed
) {}
