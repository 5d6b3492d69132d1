package uk.gegc.assessment.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Editable working copy of a test. A {@code null} test id means the draft has never been published.
 * The unique index on {@code test_id} keeps at most one draft per published test.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "drafts", uniqueConstraints = @UniqueConstraint(name = "uk_drafts_test_id", columnNames = "test_id"))
public class Draft {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "test_id")
    private UUID testId;

    @Column(name = "course_id")
    private UUID courseId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "min_point", nullable = false)
    private Integer minPoint;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isPublished() {
        return testId != null;
    }
}
