package uk.gegc.assessment.features.attempt.application;

import uk.gegc.assessment.features.attempt.api.dto.SaveAnswersRequest;
import uk.gegc.assessment.features.attempt.api.dto.UpsertAnswersRequest;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;

import java.util.UUID;

/**
 * Records answers into an attempt's version document and completes the attempt.
 * Every write holds the attempt's row lock for its read-modify-write cycle.
 */
public interface AnswerRecorder {

    /**
     * Records the first submission for a question. A question that already holds answers is
     * left untouched and {@link AnswerRecordResult#IGNORED} is returned.
     */
    AnswerRecordResult saveAnswers(UUID attemptId, SaveAnswersRequest request);

    /**
     * Records a submission, replacing anything recorded for the question before.
     */
    AnswerRecordResult upsertAnswers(UUID attemptId, UpsertAnswersRequest request);

    /**
     * Marks the attempt completed with the given score and stores its snapshot. The attempt
     * date is set on the first completion only.
     *
     * @param snapshotJson snapshot to store, or {@code null} to store the attempt version document
     */
    TestAttempt completeAttemptById(UUID attemptId, int totalPoints, String snapshotJson);
}
