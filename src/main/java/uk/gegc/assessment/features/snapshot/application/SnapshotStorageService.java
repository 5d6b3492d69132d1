package uk.gegc.assessment.features.snapshot.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a completed attempt snapshot is kept inline in the attempt row or offloaded
 * to object storage. Storage failures never reach the caller: the snapshot falls back inline.
 */
public interface SnapshotStorageService {

    /**
     * Stores the snapshot and returns the value to keep in the attempt row: either the snapshot
     * itself or an {@code s3://} pointer to it.
     */
    String store(UUID studentId, UUID testId, UUID attemptId, String snapshotJson);

    /**
     * Resolves the attempt's snapshot, downloading it when the row holds a pointer.
     */
    Optional<String> load(UUID attemptId);

    /**
     * Deletes the attempt. Its offloaded snapshot is removed on a best-effort basis first.
     */
    void delete(UUID attemptId);

    List<UUID> listSnapshots(UUID studentId, UUID testId);
}
