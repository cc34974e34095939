package org.archivum.retention.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the MinIO/S3 archive copy.
 * Maps to storage.minio.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "storage.minio")
public class MinioProperties {

    /**
     * Enables the cloud storage location for archives.
     */
    private boolean enabled = false;

    /**
     * MinIO endpoint URL.
     */
    private String endpoint = "http://localhost:9000";

    /**
     * MinIO access key.
     */
    private String accessKey = "minioadmin";

    /**
     * MinIO secret key.
     */
    private String secretKey = "minioadmin";

    /**
     * Bucket name for archive storage.
     */
    private String bucketName = "retention-archives";
}
