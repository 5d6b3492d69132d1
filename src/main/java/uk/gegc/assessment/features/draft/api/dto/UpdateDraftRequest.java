package uk.gegc.assessment.features.draft.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;

import java.util.List;

@Schema(name = "UpdateDraftRequest", description = "Replacement content for an existing draft")
public record UpdateDraftRequest(
        @Schema(description = "Test title", example = "Geography basics")
        String title,

        @Schema(description = "Minimum points needed to pass", example = "3")
        Integer minPoint,

        @Schema(description = "Optional description")
        String description,

        @Schema(description = "Questions in display order")
        List<QuestionContentRequest> questions
) {
    public UpdateDraftRequest {
        questions = (questions == null ? List.of() : questions);
    }
}
