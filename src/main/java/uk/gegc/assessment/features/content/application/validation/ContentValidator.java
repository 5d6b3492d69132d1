package uk.gegc.assessment.features.content.application.validation;

import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.content.api.dto.AnswerContentRequest;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.List;

/**
 * Rules every test or draft must satisfy before it is saved or published. Validation stops at
 * the first violation; question-level failures carry the 1-based question index.
 */
@Component
public class ContentValidator {

    public static final int MINIMUM_ANSWERS_PER_QUESTION = 2;

    public void validate(String title, Integer minPoint, List<QuestionContentRequest> questions) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Test title is required");
        }
        if (minPoint == null) {
            throw new ValidationException("Minimum pass threshold is required");
        }
        if (minPoint < 0) {
            throw new ValidationException("Minimum pass threshold cannot be negative");
        }
        if (questions == null || questions.isEmpty()) {
            throw new ValidationException("Test must contain at least one question");
        }

        long maxTotalPoints = 0;
        for (int i = 0; i < questions.size(); i++) {
            int questionIndex = i + 1;
            QuestionContentRequest question = questions.get(i);
            validateQuestion(question, questionIndex);
            maxTotalPoints = Math.addExact(maxTotalPoints, question.maxPoints());
            if (maxTotalPoints > Integer.MAX_VALUE) {
                throw new ValidationException("Question " + questionIndex
                        + ": the maximum achievable score cannot exceed " + Integer.MAX_VALUE, questionIndex);
            }
        }

        if (minPoint > maxTotalPoints) {
            throw new ValidationException("Minimum pass threshold (" + minPoint
                    + ") cannot exceed the maximum achievable score (" + maxTotalPoints + ")");
        }
    }

    private void validateQuestion(QuestionContentRequest question, int questionIndex) {
        if (question == null || question.text() == null || question.text().isBlank()) {
            throw new ValidationException("Question " + questionIndex + " must not be empty", questionIndex);
        }
        List<AnswerContentRequest> answers = question.answers();
        if (answers.size() < MINIMUM_ANSWERS_PER_QUESTION) {
            throw new ValidationException("Question " + questionIndex + " must contain at least "
                    + MINIMUM_ANSWERS_PER_QUESTION + " answers", questionIndex);
        }

        boolean hasCorrectAnswer = false;
        for (AnswerContentRequest answer : answers) {
            if (answer == null || answer.text() == null || answer.text().isBlank()) {
                throw new ValidationException("Question " + questionIndex + ": some answers are empty", questionIndex);
            }
            if (answer.score() != null && answer.score() < 0) {
                throw new ValidationException("Question " + questionIndex + ": answer scores cannot be negative", questionIndex);
            }
            if (answer.score() != null && answer.score() > 0) {
                hasCorrectAnswer = true;
            }
        }
        if (!hasCorrectAnswer) {
            throw new ValidationException("Question " + questionIndex
                    + " must contain at least one correct answer (score > 0)", questionIndex);
        }
    }
}
