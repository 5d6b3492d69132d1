package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.attempt.application.AnswerRecordResult;

import java.util.UUID;

@Schema(name = "RecordAnswersResponse", description = "Outcome of an answer submission")
public record RecordAnswersResponse(
        UUID attemptId,
        UUID questionId,
        @Schema(description = "RECORDED, or IGNORED when the question already had answers")
        AnswerRecordResult result
) {
}
