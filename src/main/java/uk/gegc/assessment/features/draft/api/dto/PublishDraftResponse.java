package uk.gegc.assessment.features.draft.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "PublishDraftResponse", description = "Outcome of publishing a draft")
public record PublishDraftResponse(
        @Schema(description = "Published test UUID")
        UUID testId,

        @Schema(description = "Draft that was published and removed")
        UUID draftId,

        @Schema(description = "True when a new test was created, false when an existing test was overwritten")
        boolean created,

        @Schema(description = "Number of questions now on the test")
        int questionCount
) {
}
