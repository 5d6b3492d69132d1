package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

@Schema(name = "InitAttemptVersionRequest", description = "Explicit question list to freeze into an attempt")
public record InitAttemptVersionRequest(
        @Schema(description = "Sequence number of this attempt for the student and test", example = "1")
        @NotNull(message = "attemptNo is required")
        @Min(value = 1, message = "attemptNo must be at least 1")
        Integer attemptNo,

        @Schema(description = "Title of the test at the time of the attempt")
        String testTitle,

        @Schema(description = "Pass threshold at the time of the attempt")
        Integer minPoint,

        @Schema(description = "Questions in the order they are shown")
        @Valid
        List<Question> questions
) {
    public InitAttemptVersionRequest {
        questions = (questions == null ? List.of() : questions);
    }

    public record Question(
            Integer order,
            @NotNull(message = "questionId is required")
            UUID questionId,
            String questionText,
            Integer maxPoints
    ) {
    }
}
