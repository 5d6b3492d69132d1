package uk.gegc.assessment.features.snapshot.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import uk.gegc.assessment.features.snapshot.application.SnapshotLocation;
import uk.gegc.assessment.features.snapshot.application.SnapshotObjectStore;
import uk.gegc.assessment.features.snapshot.config.SnapshotStorageProperties;
import uk.gegc.assessment.shared.exception.SnapshotStorageException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.snapshots", name = "enabled", havingValue = "true")
public class S3SnapshotObjectStore implements SnapshotObjectStore {

    static final String SNAPSHOT_SUFFIX = ".json";
    static final String CONTENT_TYPE = "application/json";

    private final S3Client s3Client;
    private final SnapshotStorageProperties properties;

    @Override
    public SnapshotLocation uploadSnapshot(UUID studentId, UUID testId, UUID attemptId, String snapshotJson) {
        String key = folder(studentId, testId) + attemptId + SNAPSHOT_SUFFIX;
        byte[] body = snapshotJson.getBytes(StandardCharsets.UTF_8);
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(properties.getBucket())
                            .key(key)
                            .contentType(CONTENT_TYPE)
                            .contentLength((long) body.length)
                            .build(),
                    RequestBody.fromBytes(body));
        } catch (SdkException ex) {
            throw new SnapshotStorageException("Failed to upload snapshot " + key, ex);
        }
        log.debug("Uploaded snapshot {} ({} bytes)", key, body.length);
        return new SnapshotLocation(properties.getBucket(), key);
    }

    @Override
    public Optional<String> downloadSnapshot(SnapshotLocation location) {
        try {
            return Optional.of(s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(location.bucket())
                    .key(location.key())
                    .build()).asUtf8String());
        } catch (NoSuchKeyException ex) {
            return Optional.empty();
        } catch (SdkException ex) {
            throw new SnapshotStorageException("Failed to download snapshot " + location.key(), ex);
        }
    }

    @Override
    public void deleteSnapshot(SnapshotLocation location) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(location.bucket())
                    .key(location.key())
                    .build());
        } catch (SdkException ex) {
            throw new SnapshotStorageException("Failed to delete snapshot " + location.key(), ex);
        }
    }

    @Override
    public List<UUID> listSnapshots(UUID studentId, UUID testId) {
        String folder = folder(studentId, testId);
        List<UUID> attemptIds = new ArrayList<>();
        try {
            s3Client.listObjectsV2Paginator(ListObjectsV2Request.builder()
                            .bucket(properties.getBucket())
                            .prefix(folder)
                            .build())
                    .contents()
                    .forEach(object -> attemptIdOf(folder, object).ifPresent(attemptIds::add));
        } catch (SdkException ex) {
            throw new SnapshotStorageException("Failed to list snapshots under " + folder, ex);
        }
        return attemptIds;
    }

    private String folder(UUID studentId, UUID testId) {
        return properties.getKeyPrefix() + "/" + studentId + "/" + testId + "/";
    }

    private Optional<UUID> attemptIdOf(String folder, S3Object object) {
        String name = object.key().substring(folder.length());
        if (!name.endsWith(SNAPSHOT_SUFFIX)) {
            return Optional.empty();
        }
        String id = name.substring(0, name.length() - SNAPSHOT_SUFFIX.length());
        try {
            return Optional.of(UUID.fromString(id));
        } catch (IllegalArgumentException ex) {
            log.debug("Skipping object {} with a non-UUID name", object.key());
            return Optional.empty();
        }
    }
}
