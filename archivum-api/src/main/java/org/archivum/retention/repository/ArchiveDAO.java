package org.archivum.retention.repository;

import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAccessEntry;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.RestorationEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

public interface ArchiveDAO {

    Mono<Archive> insert(Archive archive);

    Mono<Archive> update(Archive archive);

    Mono<Archive> findById(String tenantId, String archiveId);

    Flux<Archive> findByTenant(String tenantId, DataType dataType, ArchiveStatus status);

    Flux<Archive> findByStatus(ArchiveStatus status);

    /**
     * Archives whose scheduled deletion date has passed and that are not on legal hold.
     */
    Flux<Archive> findDueForDeletion(OffsetDateTime now, String tenantId);

    Mono<Void> delete(String archiveId);

    Mono<Void> appendAuditEntry(ArchiveAuditEntry entry);

    Mono<Void> appendAccessEntry(ArchiveAccessEntry entry);

    Mono<Void> appendRestoration(RestorationEntry entry);

    Flux<ArchiveAuditEntry> getAuditTrail(String archiveId);

    Flux<ArchiveAccessEntry> getAccessLog(String archiveId);

    Flux<RestorationEntry> getRestorationHistory(String archiveId);
}
