package uk.gegc.assessment.features.draft.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.assessment.features.draft.api.dto.DraftDto;
import uk.gegc.assessment.features.draft.api.dto.DraftSummaryDto;
import uk.gegc.assessment.features.draft.api.dto.PublishDraftResponse;
import uk.gegc.assessment.features.draft.api.dto.SaveDraftRequest;
import uk.gegc.assessment.features.draft.api.dto.UpdateDraftRequest;
import uk.gegc.assessment.features.draft.application.DraftService;

import java.util.List;
import java.util.UUID;

@Tag(name = "Drafts", description = "Editable working copies of tests and their publication")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DraftController {

    private final DraftService draftService;

    @Operation(
            summary = "Open a draft of a test",
            description = "Returns the test's draft, creating it as a copy of the published content if none exists yet."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Draft returned"),
            @ApiResponse(responseCode = "404", description = "Test not found")
    })
    @PostMapping("/tests/{testId}/draft")
    public ResponseEntity<DraftDto> createDraftFromTest(
            @Parameter(description = "UUID of the published test", required = true)
            @PathVariable UUID testId
    ) {
        return ResponseEntity.ok(draftService.createDraftFromTest(testId));
    }

    @Operation(summary = "Get the draft of a test")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Draft returned"),
            @ApiResponse(responseCode = "404", description = "The test has no draft")
    })
    @GetMapping("/tests/{testId}/draft")
    public ResponseEntity<DraftDto> getDraftForTest(@PathVariable UUID testId) {
        return ResponseEntity.ok(draftService.getDraftForTest(testId));
    }

    @Operation(
            summary = "Save a draft",
            description = "Creates a draft, or replaces the content of the existing draft of the given test."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Draft saved"),
            @ApiResponse(responseCode = "400", description = "Content failed validation"),
            @ApiResponse(responseCode = "404", description = "Test or course not found")
    })
    @PostMapping("/drafts")
    public ResponseEntity<DraftDto> saveDraft(@RequestBody @Valid SaveDraftRequest request) {
        return ResponseEntity.ok(draftService.saveDraft(request));
    }

    @Operation(summary = "Get a draft")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Draft returned"),
            @ApiResponse(responseCode = "404", description = "Draft not found")
    })
    @GetMapping("/drafts/{id}")
    public ResponseEntity<DraftDto> getDraft(
            @Parameter(description = "UUID of the draft", required = true)
            @PathVariable UUID id
    ) {
        return ResponseEntity.ok(draftService.getDraft(id));
    }

    @Operation(summary = "List drafts of a course")
    @GetMapping("/drafts")
    public ResponseEntity<List<DraftSummaryDto>> listDrafts(@RequestParam UUID courseId) {
        return ResponseEntity.ok(draftService.listDraftsByCourse(courseId));
    }

    @Operation(summary = "Replace a draft's content")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Draft updated"),
            @ApiResponse(responseCode = "400", description = "Content failed validation"),
            @ApiResponse(responseCode = "404", description = "Draft not found")
    })
    @PutMapping("/drafts/{id}")
    public ResponseEntity<DraftDto> updateDraft(
            @Parameter(description = "UUID of the draft", required = true)
            @PathVariable UUID id,
            @RequestBody @Valid UpdateDraftRequest request
    ) {
        return ResponseEntity.ok(draftService.updateDraft(id, request));
    }

    @Operation(
            summary = "Publish a draft",
            description = "Overwrites the linked test (or creates a new one) with the draft content, then deletes the draft."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Draft published"),
            @ApiResponse(responseCode = "400", description = "Draft content failed validation"),
            @ApiResponse(responseCode = "404", description = "Draft not found")
    })
    @PostMapping("/drafts/{id}/publish")
    public ResponseEntity<PublishDraftResponse> publish(
            @Parameter(description = "UUID of the draft", required = true)
            @PathVariable UUID id
    ) {
        return ResponseEntity.ok(draftService.publish(id));
    }

    @Operation(summary = "Delete a draft", description = "Discards the draft and its content. The published test is untouched.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Draft deleted"),
            @ApiResponse(responseCode = "404", description = "Draft not found")
    })
    @DeleteMapping("/drafts/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteDraft(@PathVariable UUID id) {
        draftService.deleteDraft(id);
    }
}
