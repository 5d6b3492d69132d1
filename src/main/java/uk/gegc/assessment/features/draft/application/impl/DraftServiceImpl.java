package uk.gegc.assessment.features.draft.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;
import uk.gegc.assessment.features.content.application.ContentStore;
import uk.gegc.assessment.features.content.application.QuestionSetWriter;
import uk.gegc.assessment.features.content.application.validation.ContentValidator;
import uk.gegc.assessment.features.content.domain.model.Draft;
import uk.gegc.assessment.features.content.domain.model.PublishedTest;
import uk.gegc.assessment.features.content.infra.mapping.ContentMapper;
import uk.gegc.assessment.features.draft.api.dto.DraftDto;
import uk.gegc.assessment.features.draft.api.dto.DraftSummaryDto;
import uk.gegc.assessment.features.draft.api.dto.PublishDraftResponse;
import uk.gegc.assessment.features.draft.api.dto.SaveDraftRequest;
import uk.gegc.assessment.features.draft.api.dto.UpdateDraftRequest;
import uk.gegc.assessment.features.draft.application.DraftService;
import uk.gegc.assessment.features.draft.infra.mapping.DraftMapper;
import uk.gegc.assessment.shared.course.CourseCatalog;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class DraftServiceImpl implements DraftService {

    private final ContentStore contentStore;
    private final QuestionSetWriter questionSetWriter;
    private final ContentValidator contentValidator;
    private final ContentMapper contentMapper;
    private final DraftMapper draftMapper;
    private final CourseCatalog courseCatalog;
    private final TransactionTemplate transactionTemplate;

    @Override
    public DraftDto createDraftFromTest(UUID testId) {
        Optional<Draft> existing = contentStore.findDraftByTestId(testId);
        if (existing.isPresent()) {
            return toDto(existing.get());
        }

        PublishedTest test = contentStore.getTest(testId);
        try {
            Draft created = transactionTemplate.execute(status -> {
                Draft draft = contentStore.createDraft(draftOf(test));
                List<QuestionContentRequest> questions = contentMapper.toContentRequests(contentStore.loadTestContent(testId));
                questionSetWriter.writeToDraft(draft.getId(), testId, questions);
                return draft;
            });
            log.info("Created draft {} from test {}", created.getId(), testId);
            return toDto(created);
        } catch (DataIntegrityViolationException ex) {
            // Another request created the draft of this test first
            Draft winner = contentStore.findDraftByTestId(testId).orElseThrow(() -> ex);
            log.info("Draft for test {} already created concurrently as {}", testId, winner.getId());
            return toDto(winner);
        }
    }

    @Override
    public DraftDto saveDraft(SaveDraftRequest request) {
        contentValidator.validate(request.title(), request.minPoint(), request.questions());
        requireCourse(request.courseId());

        UUID testId = request.testId();
        if (testId != null) {
            contentStore.getTest(testId);
            Optional<Draft> existing = contentStore.findDraftByTestId(testId);
            if (existing.isPresent()) {
                return replaceContent(existing.get().getId(), request);
            }
        }

        try {
            Draft created = transactionTemplate.execute(status -> {
                Draft draft = new Draft();
                draft.setTestId(testId);
                applyFields(draft, request.courseId(), request.title(), request.minPoint(), request.description());
                Draft saved = contentStore.createDraft(draft);
                questionSetWriter.writeToDraft(saved.getId(), testId, request.questions());
                return saved;
            });
            log.info("Created draft {} for test {}", created.getId(), testId);
            return toDto(created);
        } catch (DataIntegrityViolationException ex) {
            if (testId == null) {
                throw ex;
            }
            Draft winner = contentStore.findDraftByTestId(testId).orElseThrow(() -> ex);
            log.info("Draft for test {} was created concurrently; replacing content of {}", testId, winner.getId());
            return replaceContent(winner.getId(), request);
        }
    }

    @Override
    public DraftDto updateDraft(UUID draftId, UpdateDraftRequest request) {
        contentValidator.validate(request.title(), request.minPoint(), request.questions());
        Draft updated = transactionTemplate.execute(status -> {
            Draft draft = contentStore.getDraft(draftId);
            applyFields(draft, draft.getCourseId(), request.title(), request.minPoint(), request.description());
            return replaceQuestions(draft, request.questions());
        });
        return toDto(updated);
    }

    @Override
    @Transactional(readOnly = true)
    public DraftDto getDraft(UUID draftId) {
        return toDto(contentStore.getDraft(draftId));
    }

    @Override
    @Transactional(readOnly = true)
    public DraftDto getDraftForTest(UUID testId) {
        Draft draft = contentStore.findDraftByTestId(testId)
                .orElseThrow(() -> new ResourceNotFoundException("No draft exists for test " + testId));
        return toDto(draft);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DraftSummaryDto> listDraftsByCourse(UUID courseId) {
        return contentStore.findDraftsByCourseId(courseId).stream()
                .map(draftMapper::toSummaryDto)
                .toList();
    }

    @Override
    @Transactional
    public PublishDraftResponse publish(UUID draftId) {
        Draft draft = contentStore.getDraft(draftId);
        List<QuestionContentRequest> questions = contentMapper.toContentRequests(contentStore.loadDraftContent(draftId));
        contentValidator.validate(draft.getTitle(), draft.getMinPoint(), questions);

        boolean created = draft.getTestId() == null;
        PublishedTest test;
        if (created) {
            PublishedTest fresh = new PublishedTest();
            copyFields(draft, fresh);
            test = contentStore.createTest(fresh);
        } else {
            PublishedTest existing = contentStore.getTest(draft.getTestId());
            copyFields(draft, existing);
            test = contentStore.updateTest(existing);
            contentStore.deleteQuestionsByTestId(test.getId());
        }
        int written = questionSetWriter.writeToTest(test.getId(), questions);
        contentStore.deleteDraft(draftId);

        log.info("Published draft {} to {} test {} with {} question(s)",
                draftId, created ? "new" : "existing", test.getId(), written);
        return new PublishDraftResponse(test.getId(), draftId, created, written);
    }

    @Override
    @Transactional
    public void deleteDraft(UUID draftId) {
        contentStore.deleteDraft(draftId);
    }

    private DraftDto replaceContent(UUID draftId, SaveDraftRequest request) {
        Draft updated = transactionTemplate.execute(status -> {
            Draft draft = contentStore.getDraft(draftId);
            UUID courseId = request.courseId() != null ? request.courseId() : draft.getCourseId();
            applyFields(draft, courseId, request.title(), request.minPoint(), request.description());
            return replaceQuestions(draft, request.questions());
        });
        return toDto(updated);
    }

    private Draft replaceQuestions(Draft draft, List<QuestionContentRequest> questions) {
        Draft saved = contentStore.updateDraft(draft);
        int removed = contentStore.deleteQuestionsByDraftId(saved.getId());
        int written = questionSetWriter.writeToDraft(saved.getId(), saved.getTestId(), questions);
        log.info("Updated draft {}: replaced {} question(s) with {}", saved.getId(), removed, written);
        return saved;
    }

    private Draft draftOf(PublishedTest test) {
        Draft draft = new Draft();
        draft.setTestId(test.getId());
        applyFields(draft, test.getCourseId(), test.getTitle(), test.getMinPoint(), test.getDescription());
        return draft;
    }

    private void applyFields(Draft draft, UUID courseId, String title, Integer minPoint, String description) {
        draft.setCourseId(courseId);
        draft.setTitle(title.trim());
        draft.setMinPoint(minPoint);
        draft.setDescription(description);
    }

    private void copyFields(Draft draft, PublishedTest test) {
        test.setCourseId(draft.getCourseId());
        test.setTitle(draft.getTitle());
        test.setMinPoint(draft.getMinPoint());
        test.setDescription(draft.getDescription());
    }

    private DraftDto toDto(Draft draft) {
        return draftMapper.toDto(draft, contentStore.loadDraftContent(draft.getId()));
    }

    private void requireCourse(UUID courseId) {
        if (courseId != null && !courseCatalog.courseExists(courseId)) {
            throw new ResourceNotFoundException("Course " + courseId + " not found");
        }
    }
}
