package uk.gegc.assessment.features.attempt.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TestAttemptRepository extends JpaRepository<TestAttempt, UUID> {

    /**
     * Loads the attempt with a row lock so read-modify-write of the answers document is
     * serialised per attempt.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM TestAttempt a WHERE a.id = :id")
    Optional<TestAttempt> findByIdForUpdate(@Param("id") UUID id);

    List<TestAttempt> findByStudentIdOrderByCreatedAtDesc(UUID studentId);

    List<TestAttempt> findByTestIdOrderByCreatedAtDesc(UUID testId);

    List<TestAttempt> findByStudentIdAndTestIdOrderByCreatedAtDesc(UUID studentId, UUID testId);

    @Query("""
            SELECT COUNT(a) FROM TestAttempt a
            WHERE a.studentId = :studentId AND a.testId = :testId
              AND (a.completed = true OR a.point IS NOT NULL)
            """)
    long countFinishedAttempts(@Param("studentId") UUID studentId, @Param("testId") UUID testId);
}
