package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "StudentSnapshotsDto", description = "Attempts of a student at a test whose snapshots are in object storage")
public record StudentSnapshotsDto(
        UUID studentId,
        UUID testId,
        List<UUID> attemptIds
) {
}
