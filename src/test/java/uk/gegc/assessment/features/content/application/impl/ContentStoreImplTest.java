package uk.gegc.assessment.features.content.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.application.QuestionWithAnswers;
import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.Draft;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.content.domain.model.Question;
import uk.gegc.assessment.features.content.domain.repository.AnswerRepository;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(ContentStoreImpl.class)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@DisplayName("ContentStoreImpl against an embedded database")
class ContentStoreImplTest {

    @Autowired
    private ContentStore contentStore;

    @Autowired
    private AnswerRepository answerRepository;

    @Autowired
    private TestEntityManager entityManager;

    private PublishedTest test;

    @BeforeEach
    void setUp() {
        PublishedTest fresh = new PublishedTest();
        fresh.setTitle("Geography");
        fresh.setMinPoint(1);
        fresh.setCourseId(UUID.randomUUID());
        test = contentStore.createTest(fresh);
    }

    private Question addTestQuestion(String text, int order, int... scores) {
        Question question = contentStore.createQuestion(Question.ownedByTest(test.getId(), text, order));
        for (int i = 0; i < scores.length; i++) {
            contentStore.createAnswer(new Answer(question.getId(), text + "-a" + (i + 1), scores[i], i + 1));
        }
        return question;
    }

    @Test
    @DisplayName("questions come back by display order with answers in their order")
    void loadTestContent_ordersQuestionsAndAnswers() {
        addTestQuestion("second", 2, 0, 1);
        addTestQuestion("first", 1, 2, 0, 3);
        entityManager.flush();
        entityManager.clear();

        List<QuestionWithAnswers> content = contentStore.loadTestContent(test.getId());

        assertThat(content).extracting(item -> item.question().getTextOfQuestion())
                .containsExactly("first", "second");
        assertThat(content.get(0).answers()).extracting(Answer::getText)
                .containsExactly("first-a1", "first-a2", "first-a3");
        assertThat(content.get(0).maxPoints()).isEqualTo(5);
    }

    @Test
    @DisplayName("draft questions are not returned as test questions even with lineage set")
    void draftQuestions_keptApartFromTestQuestions() {
        addTestQuestion("live", 1, 1, 0);
        Draft draft = new Draft();
        draft.setTestId(test.getId());
        draft.setTitle("Geography");
        draft.setMinPoint(1);
        draft = contentStore.createDraft(draft);
        contentStore.createQuestion(Question.ownedByDraft(draft.getId(), test.getId(), "edited", 1));

        assertThat(contentStore.getQuestionsByTestId(test.getId()))
                .extracting(Question::getTextOfQuestion).containsExactly("live");
        assertThat(contentStore.getQuestionsByDraftId(draft.getId()))
                .extracting(Question::getTextOfQuestion).containsExactly("edited");
    }

    @Test
    @DisplayName("deleting a question removes its answers")
    void deleteQuestion_cascadesAnswers() {
        Question question = addTestQuestion("q", 1, 1, 0);
        entityManager.flush();

        contentStore.deleteQuestion(question.getId());
        entityManager.flush();

        assertThat(answerRepository.findByQuestionIdOrderBySortOrderAscIdAsc(question.getId())).isEmpty();
        assertThat(contentStore.getQuestionsByTestId(test.getId())).isEmpty();
    }

    @Test
    @DisplayName("deleting a test removes its content and unlinks its draft")
    void deleteTest_unlinksDraft() {
        addTestQuestion("q", 1, 1, 0);
        Draft draft = new Draft();
        draft.setTestId(test.getId());
        draft.setTitle("Geography");
        draft.setMinPoint(1);
        UUID draftId = contentStore.createDraft(draft).getId();

        contentStore.deleteTest(test.getId());
        entityManager.flush();
        entityManager.clear();

        assertThat(contentStore.findTest(test.getId())).isEmpty();
        assertThat(contentStore.getQuestionsByTestId(test.getId())).isEmpty();
        assertThat(contentStore.getDraft(draftId).getTestId()).isNull();
    }

    @Test
    @DisplayName("missing ids fail with ResourceNotFoundException")
    void missingIds_notFound() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> contentStore.getTest(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> contentStore.getDraft(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> contentStore.deleteQuestion(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> contentStore.createAnswer(new Answer(missing, "a", 1, 1)))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> contentStore.createQuestion(Question.ownedByTest(missing, "q", 1)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("a second draft for the same test violates the unique index")
    void secondDraftForTest_rejected() {
        Draft first = new Draft();
        first.setTestId(test.getId());
        first.setTitle("one");
        first.setMinPoint(0);
        contentStore.createDraft(first);

        Draft second = new Draft();
        second.setTestId(test.getId());
        second.setTitle("two");
        second.setMinPoint(0);

        assertThatThrownBy(() -> contentStore.createDraft(second))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
