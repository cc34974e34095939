package org.archivum.retention.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Master key used to wrap per-archive data keys.
 * Maps to archivum.encryption.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "archivum.encryption")
public class EncryptionProperties {

    /**
     * Base64-encoded 256-bit AES key.
     */
    private String masterKey;

    /**
     * Identifier of the master key, stored next to every wrapped data key.
     */
    private String masterKeyId = "platform-master-v1";
}
