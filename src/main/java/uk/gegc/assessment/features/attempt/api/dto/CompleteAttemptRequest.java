package uk.gegc.assessment.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "CompleteAttemptRequest", description = "Final score of an attempt")
public record CompleteAttemptRequest(
        @Schema(description = "Total points scored", example = "7")
        @NotNull(message = "totalPoints is required")
        @PositiveOrZero(message = "totalPoints cannot be negative")
        Integer totalPoints,

        @Schema(description = "Snapshot to store; defaults to the attempt version document", type = "object")
        JsonNode snapshot
) {
    public String snapshotJson() {
        return (snapshot == null || snapshot.isNull()) ? null : snapshot.toString();
    }
}
