package uk.gegc.assessment.features.attempt.application;

import uk.gegc.assessment.features.attempt.api.dto.StudentStatsDto;

import java.util.UUID;

public interface AttemptStatsService {

    StudentStatsDto getStudentStats(UUID studentId);
}
