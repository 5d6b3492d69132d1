package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "QuestionDto", description = "Stored question with its answers")
public record QuestionDto(
        @Schema(description = "Question UUID")
        UUID id,

        @Schema(description = "Question text")
        String text,

        @Schema(description = "Display order", example = "1")
        Integer order,

        @Schema(description = "Sum of positive answer scores", example = "2")
        int maxPoints,

        @Schema(description = "Answer options in display order")
        List<AnswerDto> answers
) {
}
