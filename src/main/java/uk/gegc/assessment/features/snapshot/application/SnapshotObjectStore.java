package uk.gegc.assessment.features.snapshot.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Object storage for completed attempt snapshots. Failures surface as
 * {@link uk.gegc.assessment.shared.exception.SnapshotStorageException}.
 */
public interface SnapshotObjectStore {

    SnapshotLocation uploadSnapshot(UUID studentId, UUID testId, UUID attemptId, String snapshotJson);

    Optional<String> downloadSnapshot(SnapshotLocation location);

    void deleteSnapshot(SnapshotLocation location);

    /**
     * Ids of the attempts that have a stored snapshot for this student and test.
     */
    List<UUID> listSnapshots(UUID studentId, UUID testId);
}
