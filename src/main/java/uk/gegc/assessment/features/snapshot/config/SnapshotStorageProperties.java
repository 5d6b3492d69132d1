package uk.gegc.assessment.features.snapshot.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.snapshots")
public class SnapshotStorageProperties {

    /**
     * When false every snapshot is kept inline in the attempt row.
     */
    private boolean enabled = false;

    @NotBlank
    private String bucket = "test-attempts";

    @NotBlank
    private String region = "us-east-1";

    /**
     * S3-compatible API endpoint, e.g. a MinIO server.
     */
    @NotNull
    private URI endpoint = URI.create("http://localhost:9000");

    @NotBlank
    private String accessKey = "dev-access-key";

    @NotBlank
    private String secretKey = "dev-secret-key";

    /**
     * Folder under which snapshots are stored as {@code {prefix}/{studentId}/{testId}/{attemptId}.json}.
     */
    @NotBlank
    private String keyPrefix = "snapshots";

    /**
     * Snapshots smaller than this many bytes stay inline even when object storage is enabled.
     */
    @PositiveOrZero
    private long inlineThresholdBytes = 0;
}
