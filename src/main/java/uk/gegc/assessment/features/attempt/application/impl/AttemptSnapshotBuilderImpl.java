package uk.gegc.assessment.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.attempt.application.AttemptQuestion;
import uk.gegc.assessment.features.attempt.application.AttemptSnapshotBuilder;
import uk.gegc.assessment.features.attempt.domain.model.AttemptAnswerEntry;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.attempt.domain.repository.TestAttemptRepository;
import uk.gegc.assessment.features.attempt.infra.version.AttemptVersionCodec;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.application.QuestionWithAnswers;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AttemptSnapshotBuilderImpl implements AttemptSnapshotBuilder {

    private final TestAttemptRepository attemptRepository;
    private final ContentStore contentStore;
    private final AttemptVersionCodec versionCodec;

    @Override
    @Transactional
    public boolean initAttemptVersionIfEmpty(UUID attemptId, int attemptNo, List<AttemptQuestion> questions,
                                             String testTitle, Integer minPoint) {
        TestAttempt attempt = lockAttempt(attemptId);
        if (attempt.hasAttemptVersion()) {
            return false;
        }
        write(attempt, build(attemptNo, questions, testTitle, minPoint));
        return true;
    }

    @Override
    @Transactional
    public AttemptVersion initFromCurrentContent(UUID attemptId) {
        TestAttempt attempt = lockAttempt(attemptId);
        if (attempt.hasAttemptVersion()) {
            return versionCodec.read(attempt.getAttemptVersion());
        }

        PublishedTest test = contentStore.getTest(attempt.getTestId());
        List<AttemptQuestion> questions = contentStore.loadTestContent(test.getId()).stream()
                .map(this::toAttemptQuestion)
                .toList();
        int attemptNo = Math.toIntExact(
                attemptRepository.countFinishedAttempts(attempt.getStudentId(), attempt.getTestId()) + 1);

        AttemptVersion version = build(attemptNo, questions, test.getTitle(), test.getMinPoint());
        write(attempt, version);
        return version;
    }

    @Override
    @Transactional(readOnly = true)
    public AttemptVersion getAttemptVersion(UUID attemptId) {
        TestAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
        return versionCodec.read(attempt.getAttemptVersion());
    }

    private AttemptVersion build(int attemptNo, List<AttemptQuestion> questions, String testTitle, Integer minPoint) {
        AttemptVersion version = new AttemptVersion(attemptNo, testTitle, minPoint);
        for (AttemptQuestion question : questions) {
            version.getAnswers().add(AttemptAnswerEntry.unanswered(
                    question.order(), question.questionId(), question.questionText(), question.maxPoints()));
        }
        return version;
    }

    private void write(TestAttempt attempt, AttemptVersion version) {
        attempt.setAttemptVersion(versionCodec.write(version));
        attemptRepository.save(attempt);
        log.info("Initialised attempt {} (attempt no {}) with {} question(s)",
                attempt.getId(), version.getAttemptNo(), version.getAnswers().size());
    }

    private AttemptQuestion toAttemptQuestion(QuestionWithAnswers item) {
        return new AttemptQuestion(
                item.question().getSortOrder(),
                item.question().getId(),
                item.question().getTextOfQuestion(),
                item.maxPoints());
    }

    private TestAttempt lockAttempt(UUID attemptId) {
        return attemptRepository.findByIdForUpdate(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
    }
}
