package uk.gegc.assessment.features.attempt.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Schema(name = "AttemptDetailsDto", description = "Attempt with its recorded questions and answers")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttemptDetailsDto(
        UUID id,
        UUID studentId,
        UUID testId,

        @Schema(description = "Test title recorded with the attempt, or the live title")
        String testTitle,

        @Schema(description = "Pass threshold the attempt is judged against")
        Integer minPoint,

        LocalDate dateOfAttempt,
        Integer point,
        UUID certificateId,
        boolean completed,

        @Schema(description = "Whether the score reached the pass threshold; null while unknown")
        Boolean passed,

        @Schema(description = "True when the completed snapshot lives in object storage")
        boolean snapshotOffloaded,

        @Schema(description = "Recorded questions and answers")
        AttemptVersion version,

        Instant createdAt
) {
}
