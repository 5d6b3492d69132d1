package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "TestSummaryDto", description = "Published test without its questions")
public record TestSummaryDto(
        UUID id,
        UUID courseId,
        String title,
        Integer minPoint,
        String description,
        Instant createdAt,
        Instant updatedAt
) {
}
