package org.archivum.retention.model;

import java.time.OffsetDateTime;

public record ScheduledDeletion(OffsetDateTime deleteAfter, boolean approvalRequired) {

    public static ScheduledDeletion none() {
        return new ScheduledDeletion(null, false);
    }
}
