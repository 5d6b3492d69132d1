package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Business-rule validation failure. When the failure concerns a single question of a
 * test or draft, {@link #getQuestionIndex()} carries its 1-based position.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends RuntimeException {

    private final Integer questionIndex;

    public ValidationException(String message) {
        super(message);
        this.questionIndex = null;
    }

    public ValidationException(String message, Integer questionIndex) {
        super(message);
        this.questionIndex = questionIndex;
    }

    public Integer getQuestionIndex() {
        return questionIndex;
    }
}
