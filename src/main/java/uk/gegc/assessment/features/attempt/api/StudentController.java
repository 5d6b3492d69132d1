package uk.gegc.assessment.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.assessment.features.attempt.api.dto.StudentSnapshotsDto;
import uk.gegc.assessment.features.attempt.api.dto.StudentStatsDto;
import uk.gegc.assessment.features.attempt.application.AttemptService;
import uk.gegc.assessment.features.attempt.application.AttemptStatsService;

import java.util.UUID;

@Tag(name = "Students", description = "Per-student results")
@RestController
@RequestMapping("/api/v1/students")
@RequiredArgsConstructor
public class StudentController {

    private final AttemptStatsService attemptStatsService;
    private final AttemptService attemptService;

    @Operation(summary = "Student statistics", description = "Attempts, passes and best scores of a student, overall and per test.")
    @GetMapping("/{studentId}/stats")
    public ResponseEntity<StudentStatsDto> getStats(
            @Parameter(description = "UUID of the student", required = true)
            @PathVariable UUID studentId
    ) {
        return ResponseEntity.ok(attemptStatsService.getStudentStats(studentId));
    }

    @Operation(summary = "Stored snapshots", description = "Attempts of the student at the test whose snapshots are in object storage.")
    @GetMapping("/{studentId}/snapshots")
    public ResponseEntity<StudentSnapshotsDto> listSnapshots(
            @PathVariable UUID studentId,
            @RequestParam UUID testId
    ) {
        return ResponseEntity.ok(attemptService.listSnapshots(studentId, testId));
    }
}
