package uk.gegc.assessment.features.attempt.application;

import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;

import java.util.Optional;

/**
 * Title and pass threshold an attempt is judged against. Values recorded in the attempt's
 * version document win over the live test, which may have been edited or deleted since.
 */
public record AttemptContext(String testTitle, Integer minPoint, boolean known) {

    public static final String UNKNOWN_TEST_TITLE = "Unknown Test";

    public static AttemptContext resolve(Optional<AttemptVersion> version, Optional<PublishedTest> test) {
        String title = version.map(AttemptVersion::getTestTitle)
                .or(() -> test.map(PublishedTest::getTitle))
                .orElse(null);
        Integer recordedMinPoint = version.map(AttemptVersion::getMinPoint).orElse(null);
        Integer minPoint = recordedMinPoint != null
                ? recordedMinPoint
                : test.map(PublishedTest::getMinPoint).orElse(null);
        return new AttemptContext(title, minPoint, recordedMinPoint != null || test.isPresent());
    }

    /**
     * {@code null} while the attempt is open, unscored, or its threshold cannot be determined.
     */
    public Boolean passed(TestAttempt attempt) {
        if (!attempt.isCompleted() || attempt.getPoint() == null || !known) {
            return null;
        }
        return minPoint == null || attempt.getPoint() >= minPoint;
    }
}
