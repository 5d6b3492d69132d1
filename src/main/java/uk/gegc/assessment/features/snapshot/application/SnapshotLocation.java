package uk.gegc.assessment.features.snapshot.application;

import java.util.Optional;

/**
 * Where an offloaded snapshot lives. Stored in the attempt row as {@code s3://{bucket}/{key}}.
 */
public record SnapshotLocation(String bucket, String key) {

    public static final String POINTER_PREFIX = "s3://";

    public String toPointer() {
        return POINTER_PREFIX + bucket + "/" + key;
    }

    public static boolean isPointer(String value) {
        return value != null && value.startsWith(POINTER_PREFIX);
    }

    public static Optional<SnapshotLocation> parsePointer(String value) {
        if (!isPointer(value)) {
            return Optional.empty();
        }
        String path = value.substring(POINTER_PREFIX.length());
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new SnapshotLocation(path.substring(0, slash), path.substring(slash + 1)));
    }
}
