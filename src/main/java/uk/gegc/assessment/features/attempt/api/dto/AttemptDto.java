package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Schema(name = "AttemptDto", description = "Attempt summary")
public record AttemptDto(
        @Schema(description = "Attempt UUID")
        UUID id,

        @Schema(description = "Student UUID")
        UUID studentId,

        @Schema(description = "Test UUID")
        UUID testId,

        @Schema(description = "Sequence number of the attempt, once initialised", example = "2")
        Integer attemptNo,

        @Schema(description = "Date of the first completion")
        LocalDate dateOfAttempt,

        @Schema(description = "Score; null until completed", example = "7")
        Integer point,

        @Schema(description = "Certificate issued for this attempt, if any")
        UUID certificateId,

        @Schema(description = "Whether the attempt is completed")
        boolean completed,

        @Schema(description = "Whether the score reached the pass threshold; null while unknown")
        Boolean passed,

        Instant createdAt
) {
}
