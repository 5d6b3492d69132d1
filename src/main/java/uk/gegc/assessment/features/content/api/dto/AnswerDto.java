package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "AnswerDto", description = "Stored answer option")
public record AnswerDto(
        @Schema(description = "Answer UUID")
        UUID id,

        @Schema(description = "Answer text", example = "Paris")
        String text,

        @Schema(description = "Points awarded for this answer", example = "1")
        Integer score,

        @Schema(description = "Display order", example = "1")
        Integer order
) {
}
