package org.archivum.retention.model;

import org.archivum.retention.enums.RestoreStatus;

import java.time.OffsetDateTime;

public record RestorationEntry(String archiveId,
                               OffsetDateTime restoredAt,
                               String restoredBy,
                               String targetLocation,
                               RestoreStatus status,
                               int recordsRestored,
                               String notes) {
}
