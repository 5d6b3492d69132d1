package uk.gegc.assessment.features.content.application;

import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.Draft;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.content.domain.model.Question;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of tests, drafts, questions and answers. Holds no business rules; lookups of
 * absent ids fail with {@link uk.gegc.assessment.shared.exception.ResourceNotFoundException}.
 */
public interface ContentStore {

    PublishedTest createTest(PublishedTest test);

    PublishedTest updateTest(PublishedTest test);

    PublishedTest getTest(UUID testId);

    Optional<PublishedTest> findTest(UUID testId);

    List<PublishedTest> findTestsByCourseId(UUID courseId);

    /**
     * Deletes the test together with its questions and answers. Drafts linked to it are kept
     * as unpublished drafts.
     */
    void deleteTest(UUID testId);

    Draft createDraft(Draft draft);

    Draft updateDraft(Draft draft);

    Draft getDraft(UUID draftId);

    Optional<Draft> findDraftByTestId(UUID testId);

    List<Draft> findDraftsByCourseId(UUID courseId);

    /**
     * Deletes the draft together with its questions and answers.
     */
    void deleteDraft(UUID draftId);

    Question createQuestion(Question question);

    void deleteQuestion(UUID questionId);

    Answer createAnswer(Answer answer);

    void deleteAnswer(UUID answerId);

    List<Question> getQuestionsByTestId(UUID testId);

    List<Question> getQuestionsByDraftId(UUID draftId);

    List<Answer> getAnswersByQuestionId(UUID questionId);

    int deleteQuestionsByTestId(UUID testId);

    int deleteQuestionsByDraftId(UUID draftId);

    List<QuestionWithAnswers> loadTestContent(UUID testId);

    List<QuestionWithAnswers> loadDraftContent(UUID draftId);
}
