package uk.gegc.assessment.features.content.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.application.QuestionWithAnswers;
import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.Draft;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.content.domain.model.Question;
import uk.gegc.assessment.features.content.domain.model.QuestionOwnerType;
import uk.gegc.assessment.features.content.domain.repository.AnswerRepository;
import uk.gegc.assessment.features.content.domain.repository.DraftRepository;
import uk.gegc.assessment.features.content.domain.repository.PublishedTestRepository;
import uk.gegc.assessment.features.content.domain.repository.QuestionRepository;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional
@Slf4j
public class ContentStoreImpl implements ContentStore {

    private static final Comparator<Answer> ANSWER_ORDER = Comparator
            .comparing(Answer::getSortOrder, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Answer::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PublishedTestRepository testRepository;
    private final DraftRepository draftRepository;
    private final QuestionRepository questionRepository;
    private final AnswerRepository answerRepository;

    @Override
    public PublishedTest createTest(PublishedTest test) {
        test.setId(null);
        return testRepository.save(test);
    }

    @Override
    public PublishedTest updateTest(PublishedTest test) {
        PublishedTest existing = getTest(test.getId());
        existing.setCourseId(test.getCourseId());
        existing.setTitle(test.getTitle());
        existing.setMinPoint(test.getMinPoint());
        existing.setDescription(test.getDescription());
        return testRepository.save(existing);
    }

    @Override
    @Transactional(readOnly = true)
    public PublishedTest getTest(UUID testId) {
        return testRepository.findById(testId)
                .orElseThrow(() -> new ResourceNotFoundException("Test " + testId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PublishedTest> findTest(UUID testId) {
        return testRepository.findById(testId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PublishedTest> findTestsByCourseId(UUID courseId) {
        return testRepository.findByCourseIdOrderByTitleAsc(courseId);
    }

    @Override
    public void deleteTest(UUID testId) {
        PublishedTest test = getTest(testId);
        int questions = deleteQuestionsByTestId(testId);
        int unlinked = draftRepository.unlinkFromTest(testId);
        testRepository.delete(test);
        log.info("Deleted test {} with {} question(s); {} draft(s) unlinked", testId, questions, unlinked);
    }

    @Override
    public Draft createDraft(Draft draft) {
        draft.setId(null);
        // Flushed so a second draft for the same test fails here on uk_drafts_test_id.
        return draftRepository.saveAndFlush(draft);
    }

    @Override
    public Draft updateDraft(Draft draft) {
        Draft existing = getDraft(draft.getId());
        existing.setTestId(draft.getTestId());
        existing.setCourseId(draft.getCourseId());
        existing.setTitle(draft.getTitle());
        existing.setMinPoint(draft.getMinPoint());
        existing.setDescription(draft.getDescription());
        return draftRepository.save(existing);
    }

    @Override
    @Transactional(readOnly = true)
    public Draft getDraft(UUID draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> new ResourceNotFoundException("Draft " + draftId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Draft> findDraftByTestId(UUID testId) {
        if (testId == null) {
            return Optional.empty();
        }
        return draftRepository.findByTestId(testId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Draft> findDraftsByCourseId(UUID courseId) {
        return draftRepository.findByCourseIdOrderByTitleAsc(courseId);
    }

    @Override
    public void deleteDraft(UUID draftId) {
        Draft draft = getDraft(draftId);
        int questions = deleteQuestionsByDraftId(draftId);
        draftRepository.delete(draft);
        log.info("Deleted draft {} with {} question(s)", draftId, questions);
    }

    @Override
    public Question createQuestion(Question question) {
        if (question.getOwnerType() == null) {
            throw new IllegalArgumentException("Question owner type is required");
        }
        if (question.getOwnerType() == QuestionOwnerType.TEST) {
            requireTest(question.getTestId());
        } else {
            requireDraft(question.getDraftId());
        }
        question.setId(null);
        return questionRepository.save(question);
    }

    @Override
    public void deleteQuestion(UUID questionId) {
        Question question = questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
        answerRepository.deleteByQuestionIds(List.of(questionId));
        questionRepository.delete(question);
    }

    @Override
    public Answer createAnswer(Answer answer) {
        if (answer.getQuestionId() == null || !questionRepository.existsById(answer.getQuestionId())) {
            throw new ResourceNotFoundException("Question " + answer.getQuestionId() + " not found");
        }
        answer.setId(null);
        return answerRepository.save(answer);
    }

    @Override
    public void deleteAnswer(UUID answerId) {
        Answer answer = answerRepository.findById(answerId)
                .orElseThrow(() -> new ResourceNotFoundException("Answer " + answerId + " not found"));
        answerRepository.delete(answer);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Question> getQuestionsByTestId(UUID testId) {
        return questionRepository.findOwnedByTest(QuestionOwnerType.TEST, testId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Question> getQuestionsByDraftId(UUID draftId) {
        return questionRepository.findByOwnerTypeAndDraftIdOrderBySortOrderAscIdAsc(QuestionOwnerType.DRAFT, draftId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Answer> getAnswersByQuestionId(UUID questionId) {
        return answerRepository.findByQuestionIdOrderBySortOrderAscIdAsc(questionId);
    }

    @Override
    public int deleteQuestionsByTestId(UUID testId) {
        return deleteAll(getQuestionsByTestId(testId));
    }

    @Override
    public int deleteQuestionsByDraftId(UUID draftId) {
        return deleteAll(getQuestionsByDraftId(draftId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuestionWithAnswers> loadTestContent(UUID testId) {
        return withAnswers(getQuestionsByTestId(testId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuestionWithAnswers> loadDraftContent(UUID draftId) {
        return withAnswers(getQuestionsByDraftId(draftId));
    }

    private int deleteAll(List<Question> questions) {
        if (questions.isEmpty()) {
            return 0;
        }
        List<UUID> ids = questions.stream().map(Question::getId).toList();
        int answers = answerRepository.deleteByQuestionIds(ids);
        questionRepository.deleteAll(questions);
        log.debug("Deleted {} question(s) and {} answer(s)", ids.size(), answers);
        return ids.size();
    }

    // Batch-loads answers to avoid one query per question.
    private List<QuestionWithAnswers> withAnswers(List<Question> questions) {
        if (questions.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = questions.stream().map(Question::getId).toList();
        Map<UUID, List<Answer>> byQuestion = answerRepository.findByQuestionIdIn(ids).stream()
                .collect(Collectors.groupingBy(Answer::getQuestionId));
        return questions.stream()
                .map(question -> new QuestionWithAnswers(
                        question,
                        byQuestion.getOrDefault(question.getId(), List.of()).stream()
                                .sorted(ANSWER_ORDER)
                                .toList()))
                .toList();
    }

    private void requireTest(UUID testId) {
        if (testId == null || !testRepository.existsById(testId)) {
            throw new ResourceNotFoundException("Test " + testId + " not found");
        }
    }

    private void requireDraft(UUID draftId) {
        if (draftId == null || !draftRepository.existsById(draftId)) {
            throw new ResourceNotFoundException("Draft " + draftId + " not found");
        }
    }
}
