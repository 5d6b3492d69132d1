package uk.gegc.assessment.features.content.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;

import java.util.List;
import java.util.UUID;

@Repository
public interface PublishedTestRepository extends JpaRepository<PublishedTest, UUID> {

    List<PublishedTest> findByCourseIdOrderByTitleAsc(UUID courseId);
}
