package org.archivum.retention.enums;

public enum ChainEventType {
    RETENTION_POLICY_CREATED,
    RETENTION_POLICY_UPDATED,
    ARCHIVE_CREATED,
    ARCHIVE_RESTORED,
    ARCHIVE_DELETED,
    ARCHIVE_LEGAL_HOLD_CHANGED,
    RECORDS_DELETED
}
