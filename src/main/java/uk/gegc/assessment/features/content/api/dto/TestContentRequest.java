package uk.gegc.assessment.features.content.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "TestContentRequest", description = "Payload for creating or replacing a published test")
public record TestContentRequest(
        @Schema(description = "Course the test belongs to", example = "d290f1ee-6c54-4b01-90e6-d701748f0851")
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
    public TestContentRequest {
        questions = (questions == null ? List.of() : questions);
    }
}
