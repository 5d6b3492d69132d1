package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "TestDto", description = "Published test with questions and answers")
public record TestDto(
        @Schema(description = "Test UUID")
        UUID id,

        @Schema(description = "Course UUID")
        UUID courseId,

        @Schema(description = "Test title", example = "Geography basics")
        String title,

        @Schema(description = "Minimum points needed to pass", example = "3")
        Integer minPoint,

        @Schema(description = "Optional description")
        String description,

        @Schema(description = "Maximum achievable points", example = "5")
        int maxPoints,

        @Schema(description = "Questions in display order")
        List<QuestionDto> questions,

        Instant createdAt,
        Instant updatedAt
) {
}
