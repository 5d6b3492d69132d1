package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "CreateAttemptRequest", description = "Starts a new attempt of a student at a test")
public record CreateAttemptRequest(
        @Schema(description = "Student taking the test", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        @NotNull(message = "studentId is required")
        UUID studentId,

        @Schema(description = "Test being taken", example = "d290f1ee-6c54-4b01-90e6-d701748f0851")
        @NotNull(message = "testId is required")
        UUID testId
) {
}
