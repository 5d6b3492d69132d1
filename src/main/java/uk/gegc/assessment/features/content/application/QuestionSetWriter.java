package uk.gegc.assessment.features.content.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.content.api.dto.AnswerContentRequest;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;
import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.Question;

import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Inserts a list of questions with their answers under a test or a draft. A question without an
 * explicit order takes its 1-based list position; answers are ordered by list position.
 */
@Component
@RequiredArgsConstructor
public class QuestionSetWriter {

    private final ContentStore contentStore;

    public int writeToTest(UUID testId, List<QuestionContentRequest> questions) {
        return write(questions, (text, order) -> Question.ownedByTest(testId, text, order));
    }

    public int writeToDraft(UUID draftId, UUID lineageTestId, List<QuestionContentRequest> questions) {
        return write(questions, (text, order) -> Question.ownedByDraft(draftId, lineageTestId, text, order));
    }

    private int write(List<QuestionContentRequest> questions, BiFunction<String, Integer, Question> factory) {
        for (int i = 0; i < questions.size(); i++) {
            QuestionContentRequest request = questions.get(i);
            int order = request.order() != null ? request.order() : i + 1;
            Question question = contentStore.createQuestion(factory.apply(request.text().trim(), order));

            List<AnswerContentRequest> answers = request.answers();
            for (int j = 0; j < answers.size(); j++) {
                AnswerContentRequest answer = answers.get(j);
                int score = answer.score() != null ? answer.score() : 0;
                contentStore.createAnswer(new Answer(question.getId(), answer.text().trim(), score, j + 1));
            }
        }
        return questions.size();
    }
}
