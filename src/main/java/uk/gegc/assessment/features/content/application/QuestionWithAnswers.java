package uk.gegc.assessment.features.content.application;

import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.Question;

import java.util.List;

public record QuestionWithAnswers(Question question, List<Answer> answers) {

    public QuestionWithAnswers {
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    /**
     * Highest score a student can earn on this question: the sum of all positive answer scores.
     * Fails with {@link ArithmeticException} rather than wrapping around.
     */
    public int maxPoints() {
        return answers.stream()
                .map(Answer::getScore)
                .filter(score -> score != null && score > 0)
                .reduce(0, Math::addExact);
    }
}
