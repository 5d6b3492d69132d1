package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

@Schema(name = "SaveAnswersRequest", description = "First answer submission for a question; repeats are ignored")
public record SaveAnswersRequest(
        @Schema(description = "Answered question")
        @NotNull(message = "questionId is required")
        UUID questionId,

        @Schema(description = "Chosen answers in the order selected")
        List<UUID> answerIds,

        @Schema(description = "Points of each chosen answer, aligned with answerIds")
        List<Integer> answerPoints,

        @Schema(description = "Points earned on the question; defaults to the sum of answerPoints")
        Integer earnedPoints
) {
}
