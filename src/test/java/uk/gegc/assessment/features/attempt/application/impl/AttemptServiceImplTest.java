package uk.gegc.assessment.features.attempt.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.assessment.BaseUnitTest;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailsDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.api.dto.CreateAttemptRequest;
import uk.gegc.assessment.features.attempt.application.AnswerRecorder;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.attempt.domain.repository.TestAttemptRepository;
import uk.gegc.assessment.features.attempt.infra.mapping.AttemptMapper;
import uk.gegc.assessment.features.attempt.infra.version.AttemptVersionCodec;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.snapshot.application.SnapshotStorageService;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("AttemptServiceImpl Tests")
class AttemptServiceImplTest extends BaseUnitTest {

    @Mock private TestAttemptRepository attemptRepository;
    @Mock private ContentStore contentStore;
    @Mock private AnswerRecorder answerRecorder;
    @Mock private SnapshotStorageService snapshotStorageService;

    private AttemptServiceImpl service;

    private final UUID studentId = UUID.randomUUID();
    private final UUID testId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new AttemptServiceImpl(attemptRepository, contentStore, answerRecorder, snapshotStorageService,
                new AttemptVersionCodec(new ObjectMapper()), new AttemptMapper());
    }

    private PublishedTest test(int minPoint) {
        PublishedTest test = new PublishedTest();
        test.setId(testId);
        test.setTitle("Capitals");
        test.setMinPoint(minPoint);
        return test;
    }

    private TestAttempt completed(int point, String version) {
        TestAttempt attempt = new TestAttempt(studentId, testId);
        attempt.setId(UUID.randomUUID());
        attempt.setCompleted(true);
        attempt.setPoint(point);
        attempt.setDateOfAttempt(LocalDate.of(2025, 1, 10));
        attempt.setAttemptVersion(version);
        return attempt;
    }

    @Test
    @DisplayName("createAttempt: stores an open attempt without a date")
    void createAttempt_open() {
        when(contentStore.getTest(testId)).thenReturn(test(2));
        when(attemptRepository.save(any(TestAttempt.class))).thenAnswer(invocation -> {
            TestAttempt attempt = invocation.getArgument(0);
            attempt.setId(UUID.randomUUID());
            return attempt;
        });

        AttemptDto dto = service.createAttempt(new CreateAttemptRequest(studentId, testId));

        assertThat(dto.studentId()).isEqualTo(studentId);
        assertThat(dto.completed()).isFalse();
        assertThat(dto.dateOfAttempt()).isNull();
        assertThat(dto.passed()).isNull();
    }

    @Test
    @DisplayName("createAttempt: unknown test is rejected")
    void createAttempt_unknownTest() {
        when(contentStore.getTest(testId)).thenThrow(new ResourceNotFoundException("Test " + testId + " not found"));

        assertThatThrownBy(() -> service.createAttempt(new CreateAttemptRequest(studentId, testId)))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(attemptRepository, never()).save(any());
    }

    @Test
    @DisplayName("getAttempt: threshold recorded in the attempt wins over the edited test")
    void getAttempt_recordedThresholdWins() {
        TestAttempt attempt = completed(2, "{\"attemptNo\":1,\"testTitle\":\"Old title\",\"minPoint\":2,\"answers\":[]}");
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(contentStore.findTest(testId)).thenReturn(Optional.of(test(5)));

        AttemptDetailsDto details = service.getAttempt(attempt.getId());

        assertThat(details.passed()).isTrue();
        assertThat(details.testTitle()).isEqualTo("Old title");
        assertThat(details.minPoint()).isEqualTo(2);
        assertThat(details.version().getAttemptNo()).isEqualTo(1);
    }

    @Test
    @DisplayName("getAttempt: deleted test and no recorded threshold leaves passed unknown")
    void getAttempt_deletedTest() {
        TestAttempt attempt = completed(4, null);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(contentStore.findTest(testId)).thenReturn(Optional.empty());

        AttemptDetailsDto details = service.getAttempt(attempt.getId());

        assertThat(details.passed()).isNull();
        assertThat(details.version()).isNull();
    }

    @Test
    @DisplayName("getAttempt: malformed document does not break the read view")
    void getAttempt_malformedVersion() {
        TestAttempt attempt = completed(1, "{broken");
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(contentStore.findTest(testId)).thenReturn(Optional.of(test(2)));

        AttemptDetailsDto details = service.getAttempt(attempt.getId());

        assertThat(details.version()).isNull();
        assertThat(details.passed()).isFalse();
    }

    @Test
    @DisplayName("listAttempts: looks each test up once")
    void listAttempts_cachesTests() {
        List<TestAttempt> attempts = List.of(completed(1, null), completed(3, null));
        when(attemptRepository.findByStudentIdAndTestIdOrderByCreatedAtDesc(studentId, testId)).thenReturn(attempts);
        when(contentStore.findTest(testId)).thenReturn(Optional.of(test(2)));

        List<AttemptDto> result = service.listAttempts(studentId, testId);

        assertThat(result).extracting(AttemptDto::passed).containsExactly(false, true);
        verify(contentStore, times(1)).findTest(testId);
    }

    @Test
    @DisplayName("listAttempts: requires a student or a test")
    void listAttempts_requiresFilter() {
        assertThatThrownBy(() -> service.listAttempts(null, null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(attemptRepository);
    }

    @Test
    @DisplayName("getSnapshot: missing snapshot yields not found")
    void getSnapshot_missing() {
        UUID attemptId = UUID.randomUUID();
        when(snapshotStorageService.load(attemptId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getSnapshot(attemptId))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("No snapshot stored");
    }
}
