package org.archivum.retention.model;

import org.archivum.retention.enums.AccessType;

import java.time.OffsetDateTime;

public record ArchiveAccessEntry(String archiveId,
                                 String accessedBy,
                                 AccessType accessType,
                                 OffsetDateTime accessedAt,
                                 String ipAddress,
                                 String userAgent) {
}
