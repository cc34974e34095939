package org.archivum.retention.dto.response;

import org.archivum.retention.enums.RestoreStatus;

import java.util.List;
import java.util.UUID;

public record RestoreResult(String archiveId,
                            int recordsRestored,
                            int totalRecords,
                            RestoreStatus status,
                            List<UUID> restored,
                            List<FailedRecord> failed) {

    public record FailedRecord(int recordIndex, String error) {}
}
