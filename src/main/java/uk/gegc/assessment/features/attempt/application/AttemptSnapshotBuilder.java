package uk.gegc.assessment.features.attempt.application;

import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;

import java.util.List;
import java.util.UUID;

/**
 * Freezes the question list of an attempt into its version document, exactly once.
 */
public interface AttemptSnapshotBuilder {

    /**
     * Writes the initial document unless the attempt already has one.
     *
     * @return {@code true} if the document was written by this call
     */
    boolean initAttemptVersionIfEmpty(UUID attemptId, int attemptNo, List<AttemptQuestion> questions,
                                      String testTitle, Integer minPoint);

    /**
     * Initialises the document from the test's live content. The attempt number is the count
     * of the student's finished attempts at the test plus one.
     */
    AttemptVersion initFromCurrentContent(UUID attemptId);

    AttemptVersion getAttemptVersion(UUID attemptId);
}
