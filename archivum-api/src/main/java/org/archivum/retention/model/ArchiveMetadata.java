package org.archivum.retention.model;

import org.archivum.retention.enums.DataType;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ArchiveMetadata(String archiveId,
                              String tenantId,
                              DataType dataType,
                              String sourceCollection,
                              int recordCount,
                              OffsetDateTime createdAt,
                              UUID retentionPolicyId) {
}
