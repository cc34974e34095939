package org.archivum.retention.enums;

public enum ArchiveAuditAction {
    CREATED,
    VERIFIED,
    CORRUPTED,
    RESTORED,
    LEGAL_HOLD_PLACED,
    LEGAL_HOLD_RELEASED,
    DELETION_SCHEDULED,
    DELETED
}
