package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Schema(name = "StudentStatsDto", description = "Aggregate results of a student over all tests")
public record StudentStatsDto(
        UUID studentId,
        int totalAttempts,
        int passedAttempts,
        @Schema(description = "Highest score over all attempts; null if none is scored")
        Integer bestScore,
        @Schema(description = "Most recent completion date")
        LocalDate lastCompletedDate,
        List<TestStatsDto> tests
) {
}
