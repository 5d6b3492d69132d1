package uk.gegc.assessment.features.content.application;

import uk.gegc.assessment.features.content.api.dto.TestContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestDto;
import uk.gegc.assessment.features.content.api.dto.TestSummaryDto;

import java.util.List;
import java.util.UUID;

public interface TestAuthoringService {

    TestDto createTest(TestContentRequest request);

    TestDto getTest(UUID testId);

    List<TestSummaryDto> listTestsByCourse(UUID courseId);

    /**
     * Replaces the test's fields and its whole question set. Attempts already taken keep their
     * own copy of the content and are unaffected.
     */
    TestDto updateTest(UUID testId, TestContentRequest request);

    void deleteTest(UUID testId);
}
