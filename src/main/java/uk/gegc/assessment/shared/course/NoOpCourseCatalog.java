package uk.gegc.assessment.shared.course;

import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * CourseCatalog that accepts every course id. The course service owns course validity, so
 * authoring runs without a check until a client for it is wired in.
 */
@Component
@Primary
public class NoOpCourseCatalog implements CourseCatalog {

    @Override
    public boolean courseExists(UUID courseId) {
        return true;
    }
}
