package uk.gegc.assessment.features.draft.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;

import java.util.List;
import java.util.UUID;

@Schema(name = "SaveDraftRequest", description = "Draft content; when testId is set the draft of that test is created or replaced")
public record SaveDraftRequest(
        @Schema(description = "Published test this draft edits, if any")
        UUID testId,

        @Schema(description = "Course the draft belongs to")
        UUID courseId,

        @Schema(description = "Test title", example = "Geography basics")
        String title,

        @Schema(description = "Minimum points needed to pass", example = "3")
        Integer minPoint,

        @Schema(description = "Optional description")
        String description,

        @Schema(description = "Questions in display order")
        List<QuestionContentRequest> questions
) {
    public SaveDraftRequest {
        questions = (questions == null ? List.of() : questions);
    }
}
