package uk.gegc.assessment.features.attempt.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailsDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.application.AttemptContext;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.snapshot.application.SnapshotLocation;

import java.util.Optional;

@Component
public class AttemptMapper {

    public AttemptDto toDto(TestAttempt attempt, Optional<AttemptVersion> version, AttemptContext context) {
        return new AttemptDto(
                attempt.getId(),
                attempt.getStudentId(),
                attempt.getTestId(),
                version.map(AttemptVersion::getAttemptNo).orElse(null),
                attempt.getDateOfAttempt(),
                attempt.getPoint(),
                attempt.getCertificateId(),
                attempt.isCompleted(),
                context.passed(attempt),
                attempt.getCreatedAt()
        );
    }

    public AttemptDetailsDto toDetailsDto(TestAttempt attempt, Optional<AttemptVersion> version, AttemptContext context) {
        return new AttemptDetailsDto(
                attempt.getId(),
                attempt.getStudentId(),
                attempt.getTestId(),
                context.testTitle(),
                context.minPoint(),
                attempt.getDateOfAttempt(),
                attempt.getPoint(),
                attempt.getCertificateId(),
                attempt.isCompleted(),
                context.passed(attempt),
                SnapshotLocation.isPointer(attempt.getAttemptSnapshot()),
                version.orElse(null),
                attempt.getCreatedAt()
        );
    }
}
