package org.archivum.retention.model;

import org.archivum.retention.enums.ArchiveAuditAction;

import java.time.OffsetDateTime;
import java.util.Map;

public record ArchiveAuditEntry(String archiveId,
                                ArchiveAuditAction action,
                                String performedBy,
                                OffsetDateTime performedAt,
                                Map<String, Object> details) {
}
