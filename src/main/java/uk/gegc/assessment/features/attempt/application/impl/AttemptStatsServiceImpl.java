package uk.gegc.assessment.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.attempt.api.dto.StudentStatsDto;
import uk.gegc.assessment.features.attempt.api.dto.TestStatsDto;
import uk.gegc.assessment.features.attempt.application.AttemptContext;
import uk.gegc.assessment.features.attempt.application.AttemptStatsService;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.attempt.domain.repository.TestAttemptRepository;
import uk.gegc.assessment.features.attempt.infra.version.AttemptVersionCodec;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AttemptStatsServiceImpl implements AttemptStatsService {

    private final TestAttemptRepository attemptRepository;
    private final ContentStore contentStore;
    private final AttemptVersionCodec versionCodec;

    @Override
    @Transactional(readOnly = true)
    public StudentStatsDto getStudentStats(UUID studentId) {
        List<TestAttempt> attempts = attemptRepository.findByStudentIdOrderByCreatedAtDesc(studentId);

        Map<UUID, Optional<PublishedTest>> tests = new HashMap<>();
        Map<UUID, List<TestAttempt>> byTest = new LinkedHashMap<>();
        Map<TestAttempt, AttemptContext> contexts = new HashMap<>();
        for (TestAttempt attempt : attempts) {
            Optional<AttemptVersion> version = versionCodec.tryRead(attempt.getAttemptVersion());
            Optional<PublishedTest> test = tests.computeIfAbsent(attempt.getTestId(), contentStore::findTest);
            contexts.put(attempt, AttemptContext.resolve(version, test));
            byTest.computeIfAbsent(attempt.getTestId(), id -> new ArrayList<>()).add(attempt);
        }

        List<TestStatsDto> perTest = new ArrayList<>();
        byTest.forEach((testId, testAttempts) -> perTest.add(new TestStatsDto(
                testId,
                titleOf(testAttempts, contexts),
                testAttempts.size(),
                bestScore(testAttempts),
                countPassed(testAttempts, contexts)
        )));

        return new StudentStatsDto(
                studentId,
                attempts.size(),
                countPassed(attempts, contexts),
                bestScore(attempts),
                lastCompletedDate(attempts),
                perTest
        );
    }

    private String titleOf(List<TestAttempt> attempts, Map<TestAttempt, AttemptContext> contexts) {
        // Attempts are newest first, so the most recent recorded title wins
        return attempts.stream()
                .map(contexts::get)
                .map(AttemptContext::testTitle)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(AttemptContext.UNKNOWN_TEST_TITLE);
    }

    private Integer bestScore(List<TestAttempt> attempts) {
        return attempts.stream()
                .map(TestAttempt::getPoint)
                .filter(Objects::nonNull)
                .max(Integer::compareTo)
                .orElse(null);
    }

    private int countPassed(List<TestAttempt> attempts, Map<TestAttempt, AttemptContext> contexts) {
        return (int) attempts.stream()
                .filter(attempt -> Boolean.TRUE.equals(contexts.get(attempt).passed(attempt)))
                .count();
    }

    private LocalDate lastCompletedDate(List<TestAttempt> attempts) {
        return attempts.stream()
                .filter(TestAttempt::isCompleted)
                .map(TestAttempt::getDateOfAttempt)
                .filter(Objects::nonNull)
                .max(LocalDate::compareTo)
                .orElse(null);
    }
}
