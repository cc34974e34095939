package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.dto.response.RestoreResult;
import org.archivum.retention.dto.response.RestoreResult.FailedRecord;
import org.archivum.retention.enums.AccessType;
import org.archivum.retention.enums.ArchiveAuditAction;
import org.archivum.retention.enums.ChainEventType;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.RestoreStatus;
import org.archivum.retention.exception.RestoreException;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAccessEntry;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.RestorationEntry;
import org.archivum.retention.model.TenantRecord;
import org.archivum.retention.repository.ArchiveDAO;
import org.archivum.retention.repository.RecordStore;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.service.ArchiveRestoreService;
import org.archivum.retention.service.ArchiveService;
import org.archivum.retention.service.RetentionAuditService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveRestoreServiceImpl implements ArchiveRestoreService {

    private final ArchiveService archiveService;
    private final ArchiveDAO archiveDAO;
    private final ArchiveContentLoader contentLoader;
    private final RecordStoreRegistry recordStoreRegistry;
    private final RetentionAuditService auditService;
    private final Clock clock;

    @Override
    public Mono<RestoreResult> restoreArchive(String tenantId, String archiveId, String restoredBy) {
        return restoreArchive(tenantId, archiveId, null, restoredBy);
    }

    @Override
    public Mono<RestoreResult> restoreArchive(String tenantId, String archiveId, DataType targetDataType, String restoredBy) {
        return archiveService.getArchive(tenantId, archiveId)
                .flatMap(archive -> {
                    if (!archive.isCanRestore()) {
                        return Mono.error(new RestoreException("Archive " + archiveId + " cannot be restored"));
                    }
                    DataType target = targetDataType != null ? targetDataType : archive.getDataType();
                    RecordStore store = recordStoreRegistry.resolve(target);
                    log.info("Restoring archive {} into {} for tenant {}", archiveId, target.getKey(), tenantId);
                    return contentLoader.loadDocument(archive)
                            .flatMap(document -> insertAll(store, archive, document.records()))
                            .flatMap(result -> recordRestoration(archive, target, result, restoredBy));
                });
    }

    private Mono<RestoreResult> insertAll(RecordStore store, Archive archive, List<TenantRecord> records) {
        List<TenantRecord> source = records != null ? records : List.of();
        return Flux.range(0, source.size())
                .concatMap(index -> {
                    TenantRecord copy = source.get(index).withoutIdentity().toBuilder()
                            .tenantId(archive.getTenantId())
                            .build();
                    return store.insert(copy)
                            .map(inserted -> RecordOutcome.restored(inserted.getId()))
                            .onErrorResume(e -> {
                                log.warn("Record {} of archive {} could not be restored: {}",
                                        index, archive.getArchiveId(), e.getMessage());
                                return Mono.just(RecordOutcome.failed(new FailedRecord(index, e.getMessage())));
                            });
                })
                .collectList()
                .map(outcomes -> {
                    List<UUID> restored = new ArrayList<>();
                    List<FailedRecord> failed = new ArrayList<>();
                    for (RecordOutcome outcome : outcomes) {
                        if (outcome.failure() == null) {
                            restored.add(outcome.id());
                        } else {
                            failed.add(outcome.failure());
                        }
                    }
                    RestoreStatus status;
                    if (failed.isEmpty()) {
                        status = RestoreStatus.SUCCESS;
                    } else if (restored.isEmpty()) {
                        status = RestoreStatus.FAILED;
                    } else {
                        status = RestoreStatus.PARTIAL;
                    }
                    return new RestoreResult(archive.getArchiveId(), restored.size(), source.size(), status,
                            List.copyOf(restored), List.copyOf(failed));
                });
    }

    private Mono<RestoreResult> recordRestoration(Archive archive, DataType target, RestoreResult result, String restoredBy) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String archiveId = archive.getArchiveId();
        String notes = result.failed().isEmpty() ? null : result.failed().size() + " of " + result.totalRecords() + " records failed";
        Map<String, Object> details = new HashMap<>();
        details.put("recordsRestored", result.recordsRestored());
        details.put("totalRecords", result.totalRecords());
        details.put("status", result.status().name());
        details.put("target", target.getKey());

        Map<String, Object> event = ArchiveServiceImpl.archiveEvent(archive, restoredBy);
        event.put("recordsRestored", result.recordsRestored());
        event.put("status", result.status().name());

        Mono<Void> history = archiveDAO.appendRestoration(new RestorationEntry(archiveId, now, restoredBy, target.getKey(),
                        result.status(), result.recordsRestored(), notes))
                .then(archiveDAO.appendAccessEntry(new ArchiveAccessEntry(archiveId, restoredBy, AccessType.RESTORE, now, null, null)))
                .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId, ArchiveAuditAction.RESTORED, restoredBy, now, details)))
                .then(auditService.record(ChainEventType.ARCHIVE_RESTORED, event));

        if (result.status() == RestoreStatus.FAILED) {
            return history.then(Mono.error(new RestoreException("All " + result.totalRecords()
                    + " records of archive " + archiveId + " failed to restore")));
        }
        return history.thenReturn(result)
                .doOnSuccess(r -> log.info("Archive {} restored: {}/{} records ({})", archiveId,
                        r.recordsRestored(), r.totalRecords(), r.status()));
    }

    private record RecordOutcome(UUID id, FailedRecord failure) {

        static RecordOutcome restored(UUID id) {
            return new RecordOutcome(id, null);
        }

        static RecordOutcome failed(FailedRecord failure) {
            return new RecordOutcome(null, failure);
        }
    }
}
