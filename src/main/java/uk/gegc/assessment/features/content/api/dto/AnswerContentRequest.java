package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "AnswerContentRequest", description = "Answer option of a question")
public record AnswerContentRequest(
        @Schema(description = "Answer text", example = "Paris")
        String text,

        @Schema(description = "Points awarded for this answer; a correct answer has score > 0", example = "1")
        Integer score
) {
}
