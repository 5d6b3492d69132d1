package uk.gegc.assessment.features.content.api;

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
import uk.gegc.assessment.features.content.api.dto.TestContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestDto;
import uk.gegc.assessment.features.content.api.dto.TestSummaryDto;
import uk.gegc.assessment.features.content.application.TestAuthoringService;

import java.util.List;
import java.util.UUID;

@Tag(name = "Tests", description = "Published tests and their question sets")
@RestController
@RequestMapping("/api/v1/tests")
@RequiredArgsConstructor
public class TestController {

    private final TestAuthoringService testAuthoringService;

    @Operation(summary = "Create a test", description = "Creates a published test together with its questions and answers.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Test created"),
            @ApiResponse(responseCode = "400", description = "Content failed validation"),
            @ApiResponse(responseCode = "404", description = "Course not found")
    })
    @PostMapping
    public ResponseEntity<TestDto> createTest(@RequestBody @Valid TestContentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(testAuthoringService.createTest(request));
    }

    @Operation(summary = "Get a test", description = "Returns the test with its questions and answers in display order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Test returned"),
            @ApiResponse(responseCode = "404", description = "Test not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<TestDto> getTest(
            @Parameter(description = "UUID of the test", required = true)
            @PathVariable UUID id
    ) {
        return ResponseEntity.ok(testAuthoringService.getTest(id));
    }

    @Operation(summary = "List tests of a course")
    @GetMapping
    public ResponseEntity<List<TestSummaryDto>> listTests(
            @Parameter(description = "UUID of the course", required = true)
            @RequestParam UUID courseId
    ) {
        return ResponseEntity.ok(testAuthoringService.listTestsByCourse(courseId));
    }

    @Operation(summary = "Replace a test", description = "Overwrites the test fields and replaces its whole question set.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Test updated"),
            @ApiResponse(responseCode = "400", description = "Content failed validation"),
            @ApiResponse(responseCode = "404", description = "Test not found")
    })
    @PutMapping("/{id}")
    public ResponseEntity<TestDto> updateTest(
            @Parameter(description = "UUID of the test", required = true)
            @PathVariable UUID id,
            @RequestBody @Valid TestContentRequest request
    ) {
        return ResponseEntity.ok(testAuthoringService.updateTest(id, request));
    }

    @Operation(summary = "Delete a test", description = "Deletes the test and its content. A linked draft is kept as an unpublished draft.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Test deleted"),
            @ApiResponse(responseCode = "404", description = "Test not found")
    })
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteTest(
            @Parameter(description = "UUID of the test", required = true)
            @PathVariable UUID id
    ) {
        testAuthoringService.deleteTest(id);
    }
}
