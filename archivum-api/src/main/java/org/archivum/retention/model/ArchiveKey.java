package org.archivum.retention.model;

import java.time.OffsetDateTime;

/**
 * A per-archive data key wrapped by the platform master key.
 */
public record ArchiveKey(String keyId,
                         String tenantId,
                         String wrappedKey,
                         String iv,
                         String masterKeyId,
                         OffsetDateTime createdAt) {
}
