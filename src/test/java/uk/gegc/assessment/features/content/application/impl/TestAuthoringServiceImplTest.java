package uk.gegc.assessment.features.content.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import uk.gegc.assessment.BaseUnitTest;
import uk.gegc.assessment.features.content.api.dto.AnswerContentRequest;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestDto;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.application.QuestionSetWriter;
import uk.gegc.assessment.features.content.application.QuestionWithAnswers;
import uk.gegc.assessment.features.content.application.validation.ContentValidator;
import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.content.domain.model.Question;
import uk.gegc.assessment.features.content.infra.mapping.ContentMapper;
import uk.gegc.assessment.shared.course.CourseCatalog;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("TestAuthoringServiceImpl Tests")
class TestAuthoringServiceImplTest extends BaseUnitTest {

    @Mock private ContentStore contentStore;
    @Mock private QuestionSetWriter questionSetWriter;
    @Mock private CourseCatalog courseCatalog;

    private TestAuthoringServiceImpl service;

    private final UUID courseId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new TestAuthoringServiceImpl(contentStore, questionSetWriter, new ContentValidator(),
                new ContentMapper(), courseCatalog);
    }

    private static List<QuestionContentRequest> questions() {
        return List.of(
                new QuestionContentRequest("Capital of France?", null, List.of(
                        new AnswerContentRequest("Paris", 2),
                        new AnswerContentRequest("Rome", 0))),
                new QuestionContentRequest("Capital of Italy?", null, List.of(
                        new AnswerContentRequest("Rome", 1),
                        new AnswerContentRequest("Paris", 0))));
    }

    private static PublishedTest storedTest(UUID id) {
        PublishedTest test = new PublishedTest();
        test.setId(id);
        test.setTitle("Capitals");
        test.setMinPoint(2);
        return test;
    }

    private static QuestionWithAnswers storedQuestion(UUID testId, String text, int order, int... scores) {
        Question question = Question.ownedByTest(testId, text, order);
        question.setId(UUID.randomUUID());
        List<Answer> answers = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            answers.add(new Answer(question.getId(), "a" + i, scores[i], i + 1));
        }
        return new QuestionWithAnswers(question, answers);
    }

    @Test
    @DisplayName("createTest: trims title, writes questions and reports max points")
    void createTest_writesQuestions() {
        UUID testId = UUID.randomUUID();
        when(courseCatalog.courseExists(courseId)).thenReturn(true);
        when(contentStore.createTest(any(PublishedTest.class))).thenReturn(storedTest(testId));
        when(contentStore.loadTestContent(testId)).thenReturn(List.of(
                storedQuestion(testId, "Capital of France?", 1, 2, 0),
                storedQuestion(testId, "Capital of Italy?", 2, 1, 0)));

        TestDto dto = service.createTest(new TestContentRequest(courseId, "  Capitals ", 2, null, questions()));

        ArgumentCaptor<PublishedTest> captor = ArgumentCaptor.forClass(PublishedTest.class);
        verify(contentStore).createTest(captor.capture());
        assertThat(captor.getValue().getTitle()).isEqualTo("Capitals");
        assertThat(captor.getValue().getCourseId()).isEqualTo(courseId);
        verify(questionSetWriter).writeToTest(testId, questions());
        assertThat(dto.id()).isEqualTo(testId);
        assertThat(dto.maxPoints()).isEqualTo(3);
        assertThat(dto.questions()).extracting(q -> q.order()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("createTest: invalid content is rejected before anything is stored")
    void createTest_invalid_nothingStored() {
        TestContentRequest request = new TestContentRequest(courseId, "Capitals", 10, null, questions());

        assertThatThrownBy(() -> service.createTest(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot exceed");

        verifyNoInteractions(contentStore, questionSetWriter);
    }

    @Test
    @DisplayName("createTest: unknown course is rejected")
    void createTest_unknownCourse() {
        when(courseCatalog.courseExists(courseId)).thenReturn(false);

        assertThatThrownBy(() -> service.createTest(new TestContentRequest(courseId, "Capitals", 1, null, questions())))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining(courseId.toString());
        verifyNoInteractions(contentStore);
    }

    @Test
    @DisplayName("updateTest: replaces the whole question set after updating fields")
    void updateTest_replacesQuestions() {
        UUID testId = UUID.randomUUID();
        PublishedTest existing = storedTest(testId);
        when(contentStore.getTest(testId)).thenReturn(existing);
        when(contentStore.updateTest(existing)).thenReturn(existing);
        when(contentStore.loadTestContent(testId)).thenReturn(List.of());

        service.updateTest(testId, new TestContentRequest(null, "Capitals v2", 1, "desc", questions()));

        InOrder order = inOrder(contentStore, questionSetWriter);
        order.verify(contentStore).updateTest(existing);
        order.verify(contentStore).deleteQuestionsByTestId(testId);
        order.verify(questionSetWriter).writeToTest(testId, questions());
        assertThat(existing.getTitle()).isEqualTo("Capitals v2");
        assertThat(existing.getDescription()).isEqualTo("desc");
        verifyNoInteractions(courseCatalog);
    }

    @Test
    @DisplayName("getTest: missing test propagates not found")
    void getTest_missing() {
        UUID testId = UUID.randomUUID();
        when(contentStore.getTest(testId)).thenThrow(new ResourceNotFoundException("Test " + testId + " not found"));

        assertThatThrownBy(() -> service.getTest(testId)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("listTestsByCourse: maps summaries in store order")
    void listTestsByCourse_mapsSummaries() {
        PublishedTest a = storedTest(UUID.randomUUID());
        PublishedTest b = storedTest(UUID.randomUUID());
        when(contentStore.findTestsByCourseId(courseId)).thenReturn(List.of(a, b));

        assertThat(service.listTestsByCourse(courseId))
                .extracting(s -> s.id())
                .containsExactly(a.getId(), b.getId());
    }
}
