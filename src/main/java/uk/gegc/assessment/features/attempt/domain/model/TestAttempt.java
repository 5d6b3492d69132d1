package uk.gegc.assessment.features.attempt.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One student's attempt at a test. {@code attemptVersion} is the self-contained JSON record of
 * what was asked and answered, so the attempt stays readable after the test changes or is deleted.
 * {@code attemptSnapshot} holds either the completed snapshot itself or a pointer to object storage.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "test_attempts", indexes = {
        @Index(name = "idx_test_attempts_student_test", columnList = "student_id, test_id"),
        @Index(name = "idx_test_attempts_test_id", columnList = "test_id")
})
public class TestAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    @Column(name = "test_id", nullable = false)
    private UUID testId;

    @Column(name = "date_of_attempt")
    private LocalDate dateOfAttempt;

    @Column(name = "point")
    private Integer point;

    @Column(name = "certificate_id")
    private UUID certificateId;

    @Column(name = "attempt_version", columnDefinition = "LONGTEXT")
    private String attemptVersion;

    @Column(name = "attempt_snapshot", columnDefinition = "LONGTEXT")
    private String attemptSnapshot;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public TestAttempt(UUID studentId, UUID testId) {
        this.studentId = studentId;
        this.testId = testId;
    }

    public boolean hasAttemptVersion() {
        return attemptVersion != null && !attemptVersion.isBlank();
    }

    /**
     * Counted as completed when flagged so or when a score was recorded.
     */
    public boolean isFinished() {
        return completed || point != null;
    }
}
