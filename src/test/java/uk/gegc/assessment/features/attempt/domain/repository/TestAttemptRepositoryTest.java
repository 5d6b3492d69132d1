package uk.gegc.assessment.features.attempt.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@DisplayName("TestAttemptRepository")
class TestAttemptRepositoryTest {

    @Autowired
    private TestAttemptRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private final UUID studentId = UUID.randomUUID();
    private final UUID testId = UUID.randomUUID();

    private TestAttempt persist(UUID student, UUID test, boolean completed, Integer point) {
        TestAttempt attempt = new TestAttempt(student, test);
        attempt.setCompleted(completed);
        attempt.setPoint(point);
        return entityManager.persistFlushFind(attempt);
    }

    @Test
    @DisplayName("finished attempts are those completed or scored")
    void countFinishedAttempts() {
        persist(studentId, testId, true, 3);
        persist(studentId, testId, false, 1);
        persist(studentId, testId, false, null);
        persist(studentId, UUID.randomUUID(), true, 5);
        persist(UUID.randomUUID(), testId, true, 5);

        assertThat(repository.countFinishedAttempts(studentId, testId)).isEqualTo(2);
    }

    @Test
    @DisplayName("findByIdForUpdate loads the attempt")
    void findByIdForUpdate() {
        TestAttempt attempt = persist(studentId, testId, false, null);
        entityManager.clear();

        assertThat(repository.findByIdForUpdate(attempt.getId()))
                .get()
                .extracting(TestAttempt::getStudentId)
                .isEqualTo(studentId);
        assertThat(repository.findByIdForUpdate(UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("each save bumps the row version")
    void versionIncrements() {
        TestAttempt attempt = persist(studentId, testId, false, null);
        Long initial = attempt.getVersion();

        attempt.setAttemptVersion("{\"answers\":[]}");
        repository.saveAndFlush(attempt);

        assertThat(attempt.getVersion()).isGreaterThan(initial);
    }

    @Test
    @DisplayName("filters by student, by test and by both")
    void finders() {
        persist(studentId, testId, false, null);
        persist(studentId, UUID.randomUUID(), false, null);
        persist(UUID.randomUUID(), testId, false, null);

        assertThat(repository.findByStudentIdOrderByCreatedAtDesc(studentId)).hasSize(2);
        assertThat(repository.findByTestIdOrderByCreatedAtDesc(testId)).hasSize(2);
        assertThat(repository.findByStudentIdAndTestIdOrderByCreatedAtDesc(studentId, testId)).hasSize(1);
    }
}
