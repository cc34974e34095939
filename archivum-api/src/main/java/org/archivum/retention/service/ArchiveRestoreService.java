package org.archivum.retention.service;

import org.archivum.retention.dto.response.RestoreResult;
import org.archivum.retention.enums.DataType;
import reactor.core.publisher.Mono;

public interface ArchiveRestoreService {

    /**
     * Restores into the archive's own data type.
     */
    Mono<RestoreResult> restoreArchive(String tenantId, String archiveId, String restoredBy);

    /**
     * Re-inserts the archived records one at a time into the store of {@code targetDataType}, for the
     * archive's tenant. Individual failures are reported in the result; when every record fails the
     * history is still written and the call fails with a restore error.
     */
    Mono<RestoreResult> restoreArchive(String tenantId, String archiveId, DataType targetDataType, String restoredBy);
}
