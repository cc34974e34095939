package org.archivum.retention.model;

import java.time.OffsetDateTime;

public record DeletionApproval(String approvedBy, OffsetDateTime approvedAt) {
}
