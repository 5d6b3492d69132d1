package uk.gegc.assessment.features.content.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.content.domain.model.Question;
import uk.gegc.assessment.features.content.domain.model.QuestionOwnerType;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID> {

    @Query("""
            SELECT q
            FROM Question q
            WHERE q.ownerType = :ownerType
              AND q.testId = :testId
            ORDER BY q.sortOrder ASC, q.id ASC
            """)
    List<Question> findOwnedByTest(@Param("ownerType") QuestionOwnerType ownerType,
                                   @Param("testId") UUID testId);

    List<Question> findByOwnerTypeAndDraftIdOrderBySortOrderAscIdAsc(QuestionOwnerType ownerType, UUID draftId);
}
