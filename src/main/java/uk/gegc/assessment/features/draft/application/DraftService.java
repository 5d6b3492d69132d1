package uk.gegc.assessment.features.draft.application;

import uk.gegc.assessment.features.draft.api.dto.DraftDto;
import uk.gegc.assessment.features.draft.api.dto.DraftSummaryDto;
import uk.gegc.assessment.features.draft.api.dto.PublishDraftResponse;
import uk.gegc.assessment.features.draft.api.dto.SaveDraftRequest;
import uk.gegc.assessment.features.draft.api.dto.UpdateDraftRequest;

import java.util.List;
import java.util.UUID;

/**
 * Moves content between the editable draft state and the published test state.
 * A published test has at most one draft at a time.
 */
public interface DraftService {

    /**
     * Returns the draft of the test, creating it as a deep copy of the test's current content
     * when none exists yet. Calling it again returns the same draft unchanged.
     */
    DraftDto createDraftFromTest(UUID testId);

    /**
     * Validates and stores draft content. With a test id the existing draft of that test is
     * replaced in place; otherwise a new draft is created.
     */
    DraftDto saveDraft(SaveDraftRequest request);

    DraftDto updateDraft(UUID draftId, UpdateDraftRequest request);

    DraftDto getDraft(UUID draftId);

    DraftDto getDraftForTest(UUID testId);

    List<DraftSummaryDto> listDraftsByCourse(UUID courseId);

    /**
     * Copies the draft's content into its test (or a new test) and removes the draft.
     */
    PublishDraftResponse publish(UUID draftId);

    void deleteDraft(UUID draftId);
}
