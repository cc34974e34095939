package org.archivum.retention.enums;

public enum PolicyStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED
}
