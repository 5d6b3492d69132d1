package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "QuestionContentRequest", description = "Question with its answer options")
public record QuestionContentRequest(
        @Schema(description = "Question text", example = "What is the capital of France?")
        String text,

        @Schema(description = "Display order; defaults to the position in the list", example = "1")
        Integer order,

        @Schema(description = "Answer options, at least two")
        List<AnswerContentRequest> answers
) {
    public QuestionContentRequest {
        answers = (answers == null ? List.of() : answers);
    }

    /**
     * Sum of all positive answer scores.
     */
    public long maxPoints() {
        return answers.stream()
                .map(AnswerContentRequest::score)
                .filter(score -> score != null && score > 0)
                .mapToLong(Integer::longValue)
                .sum();
    }
}
