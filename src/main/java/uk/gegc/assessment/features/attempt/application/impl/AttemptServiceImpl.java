package uk.gegc.assessment.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailsDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.api.dto.CompleteAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.CreateAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.StudentSnapshotsDto;
import uk.gegc.assessment.features.attempt.application.AnswerRecorder;
import uk.gegc.assessment.features.attempt.application.AttemptContext;
import uk.gegc.assessment.features.attempt.application.AttemptService;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.attempt.domain.repository.TestAttemptRepository;
import uk.gegc.assessment.features.attempt.infra.mapping.AttemptMapper;
import uk.gegc.assessment.features.attempt.infra.version.AttemptVersionCodec;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.snapshot.application.SnapshotStorageService;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AttemptServiceImpl implements AttemptService {

    private final TestAttemptRepository attemptRepository;
    private final ContentStore contentStore;
    private final AnswerRecorder answerRecorder;
    private final SnapshotStorageService snapshotStorageService;
    private final AttemptVersionCodec versionCodec;
    private final AttemptMapper attemptMapper;

    @Override
    @Transactional
    public AttemptDto createAttempt(CreateAttemptRequest request) {
        PublishedTest test = contentStore.getTest(request.testId());
        TestAttempt attempt = attemptRepository.save(new TestAttempt(request.studentId(), test.getId()));
        log.info("Student {} started attempt {} at test {}", request.studentId(), attempt.getId(), test.getId());
        return attemptMapper.toDto(attempt, Optional.empty(), AttemptContext.resolve(Optional.empty(), Optional.of(test)));
    }

    @Override
    @Transactional(readOnly = true)
    public AttemptDetailsDto getAttempt(UUID attemptId) {
        return toDetails(findAttempt(attemptId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<AttemptDto> listAttempts(UUID studentId, UUID testId) {
        List<TestAttempt> attempts;
        if (studentId != null && testId != null) {
            attempts = attemptRepository.findByStudentIdAndTestIdOrderByCreatedAtDesc(studentId, testId);
        } else if (studentId != null) {
            attempts = attemptRepository.findByStudentIdOrderByCreatedAtDesc(studentId);
        } else if (testId != null) {
            attempts = attemptRepository.findByTestIdOrderByCreatedAtDesc(testId);
        } else {
            throw new IllegalArgumentException("Either studentId or testId must be provided");
        }

        Map<UUID, Optional<PublishedTest>> tests = new HashMap<>();
        return attempts.stream()
                .map(attempt -> {
                    Optional<AttemptVersion> version = versionCodec.tryRead(attempt.getAttemptVersion());
                    Optional<PublishedTest> test = tests.computeIfAbsent(attempt.getTestId(), contentStore::findTest);
                    return attemptMapper.toDto(attempt, version, AttemptContext.resolve(version, test));
                })
                .toList();
    }

    @Override
    @Transactional
    public AttemptDetailsDto completeAttempt(UUID attemptId, CompleteAttemptRequest request) {
        TestAttempt attempt = answerRecorder.completeAttemptById(attemptId, request.totalPoints(), request.snapshotJson());
        return toDetails(attempt);
    }

    @Override
    public String getSnapshot(UUID attemptId) {
        return snapshotStorageService.load(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("No snapshot stored for attempt " + attemptId));
    }

    @Override
    public void deleteAttempt(UUID attemptId) {
        snapshotStorageService.delete(attemptId);
    }

    @Override
    public StudentSnapshotsDto listSnapshots(UUID studentId, UUID testId) {
        return new StudentSnapshotsDto(studentId, testId, snapshotStorageService.listSnapshots(studentId, testId));
    }

    private AttemptDetailsDto toDetails(TestAttempt attempt) {
        Optional<AttemptVersion> version = versionCodec.tryRead(attempt.getAttemptVersion());
        Optional<PublishedTest> test = contentStore.findTest(attempt.getTestId());
        return attemptMapper.toDetailsDto(attempt, version, AttemptContext.resolve(version, test));
    }

    private TestAttempt findAttempt(UUID attemptId) {
        return attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
    }
}
