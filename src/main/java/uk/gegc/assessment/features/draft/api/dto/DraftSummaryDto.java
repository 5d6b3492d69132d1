package uk.gegc.assessment.features.draft.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "DraftSummaryDto", description = "Draft without its questions")
public record DraftSummaryDto(
        UUID id,
        UUID testId,
        UUID courseId,
        String title,
        Integer minPoint,
        String description,
        @Schema(description = "True when the draft edits an already published test")
        boolean published,
        Instant createdAt,
        Instant updatedAt
) {
}
