package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when answers are recorded into an attempt whose result has already been fixed.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class AttemptAlreadyCompletedException extends RuntimeException {

    private final UUID attemptId;

    public AttemptAlreadyCompletedException(UUID attemptId) {
        super("Attempt " + attemptId + " is already completed. Answers can no longer be changed.");
        this.attemptId = attemptId;
    }

    public UUID getAttemptId() {
        return attemptId;
    }
}
