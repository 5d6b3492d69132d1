package uk.gegc.assessment.features.draft.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.content.api.dto.QuestionDto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "DraftDto", description = "Draft with questions and answers")
public record DraftDto(
        @Schema(description = "Draft UUID")
        UUID id,

        @Schema(description = "Published test this draft edits; null for a never-published draft")
        UUID testId,

        @Schema(description = "Course UUID")
        UUID courseId,

        @Schema(description = "Test title")
        String title,

        @Schema(description = "Minimum points needed to pass")
        Integer minPoint,

        @Schema(description = "Optional description")
        String description,

        @Schema(description = "True when the draft edits an already published test")
        boolean published,

        @Schema(description = "Maximum achievable points")
        int maxPoints,

        @Schema(description = "Questions in display order")
        List<QuestionDto> questions,

        Instant createdAt,
        Instant updatedAt
) {
}
