package uk.gegc.assessment.features.content.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.content.api.dto.AnswerContentRequest;
import uk.gegc.assessment.features.content.api.dto.AnswerDto;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;
import uk.gegc.assessment.features.content.api.dto.QuestionDto;
import uk.gegc.assessment.features.content.api.dto.TestDto;
import uk.gegc.assessment.features.content.api.dto.TestSummaryDto;
import uk.gegc.assessment.features.content.application.QuestionWithAnswers;
import uk.gegc.assessment.features.content.domain.model.Answer;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;

import java.util.List;

@Component
public class ContentMapper {

    public TestSummaryDto toSummaryDto(PublishedTest test) {
        return new TestSummaryDto(
                test.getId(),
                test.getCourseId(),
                test.getTitle(),
                test.getMinPoint(),
                test.getDescription(),
                test.getCreatedAt(),
                test.getUpdatedAt()
        );
    }

    public TestDto toDto(PublishedTest test, List<QuestionWithAnswers> content) {
        List<QuestionDto> questions = toQuestionDtos(content);
        return new TestDto(
                test.getId(),
                test.getCourseId(),
                test.getTitle(),
                test.getMinPoint(),
                test.getDescription(),
                questions.stream().mapToInt(QuestionDto::maxPoints).sum(),
                questions,
                test.getCreatedAt(),
                test.getUpdatedAt()
        );
    }

    public List<QuestionDto> toQuestionDtos(List<QuestionWithAnswers> content) {
        return content.stream().map(this::toQuestionDto).toList();
    }

    public QuestionDto toQuestionDto(QuestionWithAnswers item) {
        return new QuestionDto(
                item.question().getId(),
                item.question().getTextOfQuestion(),
                item.question().getSortOrder(),
                item.maxPoints(),
                item.answers().stream().map(this::toAnswerDto).toList()
        );
    }

    public AnswerDto toAnswerDto(Answer answer) {
        return new AnswerDto(answer.getId(), answer.getText(), answer.getScore(), answer.getSortOrder());
    }

    /**
     * Turns stored content back into the request shape so it can be validated or written
     * under another owner.
     */
    public List<QuestionContentRequest> toContentRequests(List<QuestionWithAnswers> content) {
        return content.stream()
                .map(item -> new QuestionContentRequest(
                        item.question().getTextOfQuestion(),
                        item.question().getSortOrder(),
                        item.answers().stream()
                                .map(answer -> new AnswerContentRequest(answer.getText(), answer.getScore()))
                                .toList()))
                .toList();
    }
}
