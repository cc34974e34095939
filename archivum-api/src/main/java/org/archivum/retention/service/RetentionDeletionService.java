package org.archivum.retention.service;

import org.archivum.retention.dto.response.ArchiveDeletionResult;
import org.archivum.retention.model.RetentionPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

public interface RetentionDeletionService {

    /**
     * Deletes the policy's records older than its retention cutoff and emits how many rows were deleted.
     */
    Mono<Long> deleteExpiredRecords(RetentionPolicy policy, OffsetDateTime now);

    /**
     * Removes the blobs and rows of archives past their scheduled deletion date. All tenants when
     * {@code tenantId} is null. One result per archive; a failure does not stop the others.
     */
    Flux<ArchiveDeletionResult> deleteExpiredArchives(String tenantId);
}
