package uk.gegc.assessment.features.attempt.application;

import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailsDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.api.dto.CompleteAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.CreateAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.StudentSnapshotsDto;

import java.util.List;
import java.util.UUID;

public interface AttemptService {

    /**
     * Opens an attempt. No date is set until the attempt is completed.
     */
    AttemptDto createAttempt(CreateAttemptRequest request);

    AttemptDetailsDto getAttempt(UUID attemptId);

    List<AttemptDto> listAttempts(UUID studentId, UUID testId);

    AttemptDetailsDto completeAttempt(UUID attemptId, CompleteAttemptRequest request);

    String getSnapshot(UUID attemptId);

    void deleteAttempt(UUID attemptId);

    StudentSnapshotsDto listSnapshots(UUID studentId, UUID testId);
}
