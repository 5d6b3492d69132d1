package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "TestStatsDto", description = "A student's results on one test")
public record TestStatsDto(
        UUID testId,
        @Schema(description = "Test title; \"Unknown Test\" when neither the test nor the attempts record it")
        String testTitle,
        int attempts,
        Integer bestScore,
        int passedCount
) {
}
