package uk.gegc.assessment.features.attempt.application;

import java.util.UUID;

/**
 * A question as it is frozen into a new attempt.
 */
public record AttemptQuestion(Integer order, UUID questionId, String questionText, Integer maxPoints) {
}
