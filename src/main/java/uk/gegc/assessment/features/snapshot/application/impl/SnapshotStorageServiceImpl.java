package uk.gegc.assessment.features.snapshot.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.attempt.domain.model.TestAttempt;
import uk.gegc.assessment.features.attempt.domain.repository.TestAttemptRepository;
import uk.gegc.assessment.features.snapshot.application.SnapshotLocation;
import uk.gegc.assessment.features.snapshot.application.SnapshotObjectStore;
import uk.gegc.assessment.features.snapshot.application.SnapshotStorageService;
import uk.gegc.assessment.features.snapshot.config.SnapshotStorageProperties;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;
import uk.gegc.assessment.shared.exception.SnapshotStorageException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotStorageServiceImpl implements SnapshotStorageService {

    private final ObjectProvider<SnapshotObjectStore> objectStoreProvider;
    private final SnapshotStorageProperties properties;
    private final TestAttemptRepository attemptRepository;

    @Override
    public String store(UUID studentId, UUID testId, UUID attemptId, String snapshotJson) {
        SnapshotObjectStore objectStore = objectStore();
        if (objectStore == null || snapshotJson == null) {
            return snapshotJson;
        }
        long size = snapshotJson.getBytes(StandardCharsets.UTF_8).length;
        if (size < properties.getInlineThresholdBytes()) {
            return snapshotJson;
        }
        try {
            SnapshotLocation location = objectStore.uploadSnapshot(studentId, testId, attemptId, snapshotJson);
            log.info("Snapshot of attempt {} offloaded to {}", attemptId, location.key());
            return location.toPointer();
        } catch (RuntimeException ex) {
            // Any upload failure degrades to inline storage
            log.warn("Object storage unavailable for attempt {}, keeping snapshot inline: {}", attemptId, ex.getMessage());
            return snapshotJson;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> load(UUID attemptId) {
        TestAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
        String stored = attempt.getAttemptSnapshot();
        Optional<SnapshotLocation> location = SnapshotLocation.parsePointer(stored);
        if (location.isEmpty()) {
            return Optional.ofNullable(stored);
        }

        SnapshotObjectStore objectStore = objectStore();
        if (objectStore != null) {
            try {
                Optional<String> downloaded = objectStore.downloadSnapshot(location.get());
                if (downloaded.isPresent()) {
                    return downloaded;
                }
                log.warn("Snapshot object {} of attempt {} is missing", location.get().key(), attemptId);
            } catch (SnapshotStorageException ex) {
                log.warn("Failed to download snapshot of attempt {}: {}", attemptId, ex.getMessage());
            }
        } else {
            log.warn("Attempt {} points to object storage, which is disabled", attemptId);
        }
        // The answers document holds the same record the snapshot was taken from
        return attempt.hasAttemptVersion() ? Optional.of(attempt.getAttemptVersion()) : Optional.empty();
    }

    @Override
    @Transactional
    public void delete(UUID attemptId) {
        TestAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
        SnapshotLocation.parsePointer(attempt.getAttemptSnapshot()).ifPresent(location -> {
            SnapshotObjectStore objectStore = objectStore();
            if (objectStore == null) {
                log.warn("Cannot delete snapshot {} of attempt {}: object storage is disabled", location.key(), attemptId);
                return;
            }
            try {
                objectStore.deleteSnapshot(location);
            } catch (SnapshotStorageException ex) {
                log.warn("Failed to delete snapshot {} of attempt {}: {}", location.key(), attemptId, ex.getMessage());
            }
        });
        attemptRepository.delete(attempt);
        log.info("Deleted attempt {}", attemptId);
    }

    @Override
    public List<UUID> listSnapshots(UUID studentId, UUID testId) {
        SnapshotObjectStore objectStore = objectStore();
        if (objectStore == null) {
            return List.of();
        }
        try {
            return objectStore.listSnapshots(studentId, testId);
        } catch (SnapshotStorageException ex) {
            log.warn("Failed to list snapshots of student {} for test {}: {}", studentId, testId, ex.getMessage());
            return List.of();
        }
    }

    private SnapshotObjectStore objectStore() {
        return properties.isEnabled() ? objectStoreProvider.getIfAvailable() : null;
    }
}
