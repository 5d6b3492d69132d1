package uk.gegc.assessment.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.assessment.features.attempt.api.dto.*;
import uk.gegc.assessment.features.attempt.application.AnswerRecordResult;
import uk.gegc.assessment.features.attempt.application.AnswerRecorder;
import uk.gegc.assessment.features.attempt.application.AttemptQuestion;
import uk.gegc.assessment.features.attempt.application.AttemptService;
import uk.gegc.assessment.features.attempt.application.AttemptSnapshotBuilder;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;

import java.util.List;
import java.util.UUID;

@Tag(name = "Attempts", description = "Capture of student attempts and their answers")
@RestController
@RequestMapping("/api/v1/attempts")
@RequiredArgsConstructor
public class AttemptController {

    private final AttemptService attemptService;
    private final AttemptSnapshotBuilder snapshotBuilder;
    private final AnswerRecorder answerRecorder;

    @Operation(summary = "Start an attempt", description = "Creates an open attempt of the student at the test.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Attempt created"),
            @ApiResponse(responseCode = "404", description = "Test not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<AttemptDto> createAttempt(@RequestBody @Valid CreateAttemptRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(attemptService.createAttempt(request));
    }

    @Operation(summary = "Get an attempt", description = "Returns the attempt with its recorded answers and pass outcome.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempt returned"),
            @ApiResponse(responseCode = "404", description = "Attempt not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<AttemptDetailsDto> getAttempt(
            @Parameter(description = "UUID of the attempt", required = true)
            @PathVariable UUID id
    ) {
        return ResponseEntity.ok(attemptService.getAttempt(id));
    }

    @Operation(summary = "List attempts", description = "Attempts of a student, of a test, or of a student at a test; newest first.")
    @GetMapping
    public ResponseEntity<List<AttemptDto>> listAttempts(
            @RequestParam(required = false) UUID studentId,
            @RequestParam(required = false) UUID testId
    ) {
        return ResponseEntity.ok(attemptService.listAttempts(studentId, testId));
    }

    @Operation(summary = "Get the attempt version document")
    @GetMapping("/{id}/version")
    public ResponseEntity<AttemptVersion> getAttemptVersion(@PathVariable UUID id) {
        return ResponseEntity.ok(snapshotBuilder.getAttemptVersion(id));
    }

    @Operation(
            summary = "Initialise the attempt version document",
            description = """
                    Freezes the attempt's question list. Without a body the questions, title and threshold
                    are taken from the test's current content. Does nothing if the attempt is already initialised.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current version document returned"),
            @ApiResponse(responseCode = "404", description = "Attempt or test not found")
    })
    @PostMapping("/{id}/version/init")
    public ResponseEntity<AttemptVersion> initAttemptVersion(
            @PathVariable UUID id,
            @RequestBody(required = false) @Valid InitAttemptVersionRequest request
    ) {
        if (request == null) {
            return ResponseEntity.ok(snapshotBuilder.initFromCurrentContent(id));
        }
        List<AttemptQuestion> questions = request.questions().stream()
                .map(q -> new AttemptQuestion(q.order(), q.questionId(), q.questionText(), q.maxPoints()))
                .toList();
        snapshotBuilder.initAttemptVersionIfEmpty(id, request.attemptNo(), questions, request.testTitle(), request.minPoint());
        return ResponseEntity.ok(snapshotBuilder.getAttemptVersion(id));
    }

    @Operation(summary = "Save answers", description = "Records the first submission for a question; later submissions are ignored.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission recorded or ignored"),
            @ApiResponse(responseCode = "400", description = "No answer ids or negative points"),
            @ApiResponse(responseCode = "404", description = "Attempt not found"),
            @ApiResponse(responseCode = "409", description = "Attempt already completed")
    })
    @PostMapping("/{id}/answers")
    public ResponseEntity<RecordAnswersResponse> saveAnswers(
            @PathVariable UUID id,
            @RequestBody @Valid SaveAnswersRequest request
    ) {
        AnswerRecordResult result = answerRecorder.saveAnswers(id, request);
        return ResponseEntity.ok(new RecordAnswersResponse(id, request.questionId(), result));
    }

    @Operation(summary = "Replace answers", description = "Records a submission for a question, overwriting any earlier one.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission recorded"),
            @ApiResponse(responseCode = "400", description = "No answer ids or negative points"),
            @ApiResponse(responseCode = "404", description = "Attempt not found"),
            @ApiResponse(responseCode = "409", description = "Attempt already completed")
    })
    @PutMapping("/{id}/answers")
    public ResponseEntity<RecordAnswersResponse> upsertAnswers(
            @PathVariable UUID id,
            @RequestBody @Valid UpsertAnswersRequest request
    ) {
        AnswerRecordResult result = answerRecorder.upsertAnswers(id, request);
        return ResponseEntity.ok(new RecordAnswersResponse(id, request.questionId(), result));
    }

    @Operation(summary = "Complete an attempt", description = "Stores the final score and the attempt snapshot.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempt completed"),
            @ApiResponse(responseCode = "400", description = "Negative score"),
            @ApiResponse(responseCode = "404", description = "Attempt not found")
    })
    @PostMapping("/{id}/complete")
    public ResponseEntity<AttemptDetailsDto> completeAttempt(
            @PathVariable UUID id,
            @RequestBody @Valid CompleteAttemptRequest request
    ) {
        return ResponseEntity.ok(attemptService.completeAttempt(id, request));
    }

    @Operation(summary = "Get the attempt snapshot", description = "Returns the stored snapshot, fetching it from object storage when offloaded.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot returned"),
            @ApiResponse(responseCode = "404", description = "Attempt not found or no snapshot stored")
    })
    @GetMapping(value = "/{id}/snapshot", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getSnapshot(@PathVariable UUID id) {
        return ResponseEntity.ok(attemptService.getSnapshot(id));
    }

    @Operation(summary = "Delete an attempt", description = "Deletes the attempt and, best effort, its offloaded snapshot.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Attempt deleted"),
            @ApiResponse(responseCode = "404", description = "Attempt not found")
    })
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAttempt(@PathVariable UUID id) {
        attemptService.deleteAttempt(id);
    }
}
