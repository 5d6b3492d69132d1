package uk.gegc.assessment.features.content.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.Question;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuestionWithAnswers")
class QuestionWithAnswersTest {

    private final UUID questionId = UUID.randomUUID();
    private final Question question = Question.ownedByTest(UUID.randomUUID(), "Q", 1);

    @Test
    @DisplayName("maxPoints sums only positive scores")
    void maxPoints_sumsPositiveScores() {
        QuestionWithAnswers item = new QuestionWithAnswers(question, List.of(
                new Answer(questionId, "a", 2, 1),
                new Answer(questionId, "b", 0, 2),
                new Answer(questionId, "c", 3, 3)));

        assertThat(item.maxPoints()).isEqualTo(5);
    }

    @Test
    @DisplayName("maxPoints fails instead of wrapping past the int range")
    void maxPoints_overflowFails() {
        QuestionWithAnswers item = new QuestionWithAnswers(question, List.of(
                new Answer(questionId, "a", Integer.MAX_VALUE, 1),
                new Answer(questionId, "b", 1, 2)));

        assertThatThrownBy(item::maxPoints).isInstanceOf(ArithmeticException.class);
    }
}
