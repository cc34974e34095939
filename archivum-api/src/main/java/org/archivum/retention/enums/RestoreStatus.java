package org.archivum.retention.enums;

public enum RestoreStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
