package org.archivum.retention.enums;

public enum AccessType {
    VIEW,
    DOWNLOAD,
    RESTORE,
    VERIFY
}
