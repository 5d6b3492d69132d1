package uk.gegc.assessment.shared.exception;

/**
 * Raised by object-storage adapters when an upload, download or delete fails.
 * The snapshot storage tier recovers from it locally.
 */
public class SnapshotStorageException extends RuntimeException {

    public SnapshotStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
