package uk.gegc.assessment.features.content.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.content.domain.model.Answer;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface AnswerRepository extends JpaRepository<Answer, UUID> {

    List<Answer> findByQuestionIdOrderBySortOrderAscIdAsc(UUID questionId);

    List<Answer> findByQuestionIdIn(Collection<UUID> questionIds);

    @Modifying
    @Query("DELETE FROM Answer a WHERE a.questionId IN :questionIds")
    int deleteByQuestionIds(@Param("questionIds") Collection<UUID> questionIds);
}
