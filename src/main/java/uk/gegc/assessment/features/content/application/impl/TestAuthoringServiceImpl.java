package uk.gegc.assessment.features.content.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.content.api.dto.TestContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestDto;
import uk.gegc.assessment.features.content.api.dto.TestSummaryDto;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.application.QuestionSetWriter;
import uk.gegc.assessment.features.content.application.TestAuthoringService;
import uk.gegc.assessment.features.content.application.validation.ContentValidator;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.content.infra.mapping.ContentMapper;
import uk.gegc.assessment.shared.course.CourseCatalog;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class TestAuthoringServiceImpl implements TestAuthoringService {

    private final ContentStore contentStore;
    private final QuestionSetWriter questionSetWriter;
    private final ContentValidator contentValidator;
    private final ContentMapper contentMapper;
    private final CourseCatalog courseCatalog;

    @Override
    @Transactional
    public TestDto createTest(TestContentRequest request) {
        contentValidator.validate(request.title(), request.minPoint(), request.questions());
        requireCourse(request.courseId());

        PublishedTest test = new PublishedTest();
        applyFields(test, request);
        PublishedTest saved = contentStore.createTest(test);
        int questions = questionSetWriter.writeToTest(saved.getId(), request.questions());

        log.info("Created test {} with {} question(s)", saved.getId(), questions);
        return contentMapper.toDto(saved, contentStore.loadTestContent(saved.getId()));
    }

    @Override
    @Transactional(readOnly = true)
    public TestDto getTest(UUID testId) {
        PublishedTest test = contentStore.getTest(testId);
        return contentMapper.toDto(test, contentStore.loadTestContent(testId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TestSummaryDto> listTestsByCourse(UUID courseId) {
        return contentStore.findTestsByCourseId(courseId).stream()
                .map(contentMapper::toSummaryDto)
                .toList();
    }

    @Override
    @Transactional
    public TestDto updateTest(UUID testId, TestContentRequest request) {
        contentValidator.validate(request.title(), request.minPoint(), request.questions());
        requireCourse(request.courseId());

        PublishedTest test = contentStore.getTest(testId);
        applyFields(test, request);
        PublishedTest saved = contentStore.updateTest(test);

        int removed = contentStore.deleteQuestionsByTestId(testId);
        int written = questionSetWriter.writeToTest(testId, request.questions());
        log.info("Updated test {}: replaced {} question(s) with {}", testId, removed, written);

        return contentMapper.toDto(saved, contentStore.loadTestContent(testId));
    }

    @Override
    @Transactional
    public void deleteTest(UUID testId) {
        contentStore.deleteTest(testId);
    }

    private void applyFields(PublishedTest test, TestContentRequest request) {
        test.setCourseId(request.courseId());
        test.setTitle(request.title().trim());
        test.setMinPoint(request.minPoint());
        test.setDescription(request.description());
    }

    private void requireCourse(UUID courseId) {
        if (courseId != null && !courseCatalog.courseExists(courseId)) {
            throw new ResourceNotFoundException("Course " + courseId + " not found");
        }
    }
}
