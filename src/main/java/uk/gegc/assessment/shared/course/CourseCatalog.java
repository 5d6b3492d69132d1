package uk.gegc.assessment.shared.course;

import java.util.UUID;

/**
 * SPI to the course service that owns course records. Tests and drafts only keep the course id;
 * authoring checks it here before content is attached to a course.
 */
public interface CourseCatalog {

    boolean courseExists(UUID courseId);
}
