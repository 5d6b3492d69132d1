package uk.gegc.assessment.features.content.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.content.domain.model.Draft;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DraftRepository extends JpaRepository<Draft, UUID> {

    Optional<Draft> findByTestId(UUID testId);

    List<Draft> findByCourseIdOrderByTitleAsc(UUID courseId);

    /**
     * Detaches drafts from a test that is being deleted; they become unpublished drafts.
     */
    @Modifying
    @Query("UPDATE Draft d SET d.testId = NULL WHERE d.testId = :testId")
    int unlinkFromTest(@Param("testId") UUID testId);
}
