package org.archivum.retention.enums;

public enum ArchiveStatus {
    CREATING,
    COMPLETED,
    FAILED,
    VERIFYING,
    VERIFIED,
    CORRUPTED
}
