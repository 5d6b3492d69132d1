package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

@Schema(name = "UpsertAnswersRequest", description = "Answer submission that replaces whatever was recorded before")
public record UpsertAnswersRequest(
        @Schema(description = "Answered question")
        @NotNull(message = "questionId is required")
        UUID questionId,

        @Schema(description = "Question text as shown to the student")
        String questionText,

        @Schema(description = "Maximum points of the question")
        Integer maxPoints,

        @Schema(description = "Chosen answers in the order selected")
        List<UUID> answerIds,

        @Schema(description = "Texts of the chosen answers, aligned with answerIds")
        List<String> answerTexts,

        @Schema(description = "Points of each chosen answer, aligned with answerIds")
        List<Integer> answerPoints,

        @Schema(description = "Points earned on the question; defaults to the sum of answerPoints")
        Integer earnedPoints
) {
}
