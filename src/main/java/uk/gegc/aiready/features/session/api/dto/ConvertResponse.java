package uk.gegc.aiready.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ConvertResponse", description = "Results of converting every pending file")
public record ConvertResponse(
    List<ConversionResultView> results,
    @Schema(example = "3") long converted,
    @Schema(example = "1") long failed
) {}
