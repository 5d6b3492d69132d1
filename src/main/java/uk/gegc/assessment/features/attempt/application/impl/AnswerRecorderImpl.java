package uk.gegc.assessment.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.attempt.api.dto.SaveAnswersRequest;
import uk.gegc.assessment.features.attempt.api.dto.UpsertAnswersRequest;
import uk.gegc.assessment.features.attempt.application.AnswerRecordResult;
import uk.gegc.assessment.features.attempt.application.AnswerRecorder;
import uk.gegc.assessment.features.attempt.domain.model.AttemptAnswerEntry;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.attempt.domain.repository.TestAttemptRepository;
import uk.gegc.assessment.features.attempt.infra.version.AttemptVersionCodec;
import uk.gegc.assessment.features.snapshot.application.SnapshotStorageService;
import uk.gegc.assessment.shared.exception.AttemptAlreadyCompletedException;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerRecorderImpl implements AnswerRecorder {

    private final TestAttemptRepository attemptRepository;
    private final AttemptVersionCodec versionCodec;
    private final SnapshotStorageService snapshotStorageService;
    private final Clock clock;

    @Override
    @Transactional
    public AnswerRecordResult saveAnswers(UUID attemptId, SaveAnswersRequest request) {
        TestAttempt attempt = lockOpenAttempt(attemptId);
        AttemptVersion version = versionCodec.read(attempt.getAttemptVersion());

        // A locked-in answer wins over any resubmission, well-formed or not
        Optional<AttemptAnswerEntry> existing = version.findEntry(request.questionId());
        if (existing.isPresent() && existing.get().hasAnswers()) {
            log.info("Question {} of attempt {} already answered; submission ignored", request.questionId(), attemptId);
            return AnswerRecordResult.IGNORED;
        }

        AnswerSelection selection = AnswerSelection.normalise(
                request.answerIds(), null, request.answerPoints(), request.earnedPoints());
        selection.applyTo(version.entryFor(request.questionId()));
        store(attempt, version);
        return AnswerRecordResult.RECORDED;
    }

    @Override
    @Transactional
    public AnswerRecordResult upsertAnswers(UUID attemptId, UpsertAnswersRequest request) {
        AnswerSelection selection = AnswerSelection.normalise(
                request.answerIds(), request.answerTexts(), request.answerPoints(), request.earnedPoints());

        TestAttempt attempt = lockOpenAttempt(attemptId);
        AttemptVersion version = versionCodec.read(attempt.getAttemptVersion());

        AttemptAnswerEntry entry = version.entryFor(request.questionId());
        selection.applyTo(entry);
        if (request.questionText() != null) {
            entry.setQuestionText(request.questionText());
        }
        if (request.maxPoints() != null) {
            entry.setMaxPoints(request.maxPoints());
        }
        store(attempt, version);
        return AnswerRecordResult.RECORDED;
    }

    @Override
    @Transactional
    public TestAttempt completeAttemptById(UUID attemptId, int totalPoints, String snapshotJson) {
        if (totalPoints < 0) {
            throw new ValidationException("Total points cannot be negative");
        }
        TestAttempt attempt = lockAttempt(attemptId);
        attempt.setCompleted(true);
        attempt.setPoint(totalPoints);
        if (attempt.getDateOfAttempt() == null) {
            attempt.setDateOfAttempt(LocalDate.now(clock));
        }

        String snapshot = snapshotJson != null ? snapshotJson : attempt.getAttemptVersion();
        if (snapshot != null && !snapshot.isBlank()) {
            attempt.setAttemptSnapshot(snapshotStorageService.store(
                    attempt.getStudentId(), attempt.getTestId(), attemptId, snapshot));
        }

        TestAttempt saved = attemptRepository.save(attempt);
        log.info("Attempt {} completed with {} point(s)", attemptId, totalPoints);
        return saved;
    }

    private void store(TestAttempt attempt, AttemptVersion version) {
        attempt.setAttemptVersion(versionCodec.write(version));
        attemptRepository.save(attempt);
    }

    private TestAttempt lockOpenAttempt(UUID attemptId) {
        TestAttempt attempt = lockAttempt(attemptId);
        if (attempt.isFinished()) {
            throw new AttemptAlreadyCompletedException(attemptId);
        }
        return attempt;
    }

    private TestAttempt lockAttempt(UUID attemptId) {
        return attemptRepository.findByIdForUpdate(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
    }
}
