package org.archivum.retention.repository;

import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.TenantRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.UUID;

/**
 * Query and delete capability of one retained data type. Every operation is scoped to a single tenant.
 */
public interface RecordStore {

    DataType dataType();

    /**
     * Live records not yet archived with {@code from <= recordDate < before}.
     */
    Flux<TenantRecord> findArchivable(String tenantId, OffsetDateTime from, OffsetDateTime before);

    Mono<Long> markArchived(String tenantId, Collection<UUID> recordIds, String archiveId);

    /**
     * Clears the archive reference of every record marked with the given archive, making them archivable again.
     */
    Mono<Long> releaseArchived(String tenantId, String archiveId);

    Mono<Long> softDeleteOlderThan(String tenantId, OffsetDateTime cutoff, String deletedBy, String reason,
                                   OffsetDateTime deletedAt);

    Mono<Long> hardDeleteOlderThan(String tenantId, OffsetDateTime cutoff);

    /**
     * Permanently removes records that were soft-deleted before the given instant.
     */
    Mono<Long> purgeSoftDeletedBefore(String tenantId, OffsetDateTime deletedBefore);

    Mono<TenantRecord> insert(TenantRecord record);
}
