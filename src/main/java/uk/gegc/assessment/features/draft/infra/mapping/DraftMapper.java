package uk.gegc.assessment.features.draft.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.content.api.dto.QuestionDto;
import uk.gegc.assessment.features.content.application.QuestionWithAnswers;
import uk.gegc.assessment.features.content.domain.model.Draft;
import uk.gegc.assessment.features.content.infra.mapping.ContentMapper;
import uk.gegc.assessment.features.draft.api.dto.DraftDto;
import uk.gegc.assessment.features.draft.api.dto.DraftSummaryDto;

import java.util.List;

@Component
@RequiredArgsConstructor
public class DraftMapper {

    private final ContentMapper contentMapper;

    public DraftSummaryDto toSummaryDto(Draft draft) {
        return new DraftSummaryDto(
                draft.getId(),
                draft.getTestId(),
                draft.getCourseId(),
                draft.getTitle(),
                draft.getMinPoint(),
                draft.getDescription(),
                draft.isPublished(),
                draft.getCreatedAt(),
                draft.getUpdatedAt()
        );
    }

    public DraftDto toDto(Draft draft, List<QuestionWithAnswers> content) {
        List<QuestionDto> questions = contentMapper.toQuestionDtos(content);
        return new DraftDto(
                draft.getId(),
                draft.getTestId(),
                draft.getCourseId(),
                draft.getTitle(),
                draft.getMinPoint(),
                draft.getDescription(),
                draft.isPublished(),
                questions.stream().mapToInt(QuestionDto::maxPoints).sum(),
                questions,
                draft.getCreatedAt(),
                draft.getUpdatedAt()
        );
    }
}
