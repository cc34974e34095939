package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.dto.response.ArchiveDeletionResult;
import org.archivum.retention.enums.ArchiveAuditAction;
import org.archivum.retention.enums.ChainEventType;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.ArchiveDAO;
import org.archivum.retention.repository.RecordStore;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.service.CutoffCalculator;
import org.archivum.retention.service.RetentionAuditService;
import org.archivum.retention.service.RetentionDeletionService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

import static org.archivum.retention.model.RetentionPolicy.SYSTEM_ACTOR;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionDeletionServiceImpl implements RetentionDeletionService {

    private final RecordStoreRegistry recordStoreRegistry;
    private final CutoffCalculator cutoffCalculator;
    private final ArchiveDAO archiveDAO;
    private final ArchiveStorageRouter storageRouter;
    private final RetentionAuditService auditService;
    private final Clock clock;

    @Override
    public Mono<Long> deleteExpiredRecords(RetentionPolicy policy, OffsetDateTime now) {
        return Mono.defer(() -> {
            RecordStore store = recordStoreRegistry.resolve(policy.getDataType());
            String tenantId = policy.getTenantId();
            DeletionSettings settings = policy.deletionSettingsOrDefault();
            OffsetDateTime cutoff = cutoffCalculator.cutoff(policy.getRetentionPeriod(), now);
            boolean hardDeleteApproved = settings.isHardDeleteApproved();
            String reason = "Retention period of " + policy.getRetentionPeriod() + " expired";

            Mono<Long> deleted;
            if (!settings.softDelete() && hardDeleteApproved) {
                deleted = store.hardDeleteOlderThan(tenantId, cutoff);
            } else {
                if (!settings.softDelete()) {
                    log.warn("Hard delete for policy {} requires an approval from {}, soft deleting instead",
                            policy.getId(), settings.approvers());
                }
                deleted = store.softDeleteOlderThan(tenantId, cutoff, SYSTEM_ACTOR, reason, now)
                        .flatMap(count -> purgeSoftDeleted(policy, store, settings, hardDeleteApproved, now).thenReturn(count));
            }
            return deleted
                    .flatMap(count -> count > 0
                            ? auditService.record(ChainEventType.RECORDS_DELETED, deletionEvent(policy, count, settings, cutoff))
                                .thenReturn(count)
                            : Mono.just(count))
                    .doOnNext(count -> log.info("Retention deleted {} {} records older than {} for tenant {}",
                            count, policy.getDataType().getKey(), cutoff, tenantId));
        });
    }

    private Mono<Long> purgeSoftDeleted(RetentionPolicy policy, RecordStore store, DeletionSettings settings,
                                        boolean hardDeleteApproved, OffsetDateTime now) {
        if (settings.hardDeleteAfter() == null) {
            return Mono.just(0L);
        }
        if (!hardDeleteApproved) {
            log.warn("Purge of soft-deleted records for policy {} skipped: approval required", policy.getId());
            return Mono.just(0L);
        }
        OffsetDateTime purgeBefore = cutoffCalculator.cutoff(settings.hardDeleteAfter(), now);
        return store.purgeSoftDeletedBefore(policy.getTenantId(), purgeBefore)
                .doOnNext(count -> log.debug("Purged {} soft-deleted {} records for tenant {}",
                        count, policy.getDataType().getKey(), policy.getTenantId()));
    }

    @Override
    public Flux<ArchiveDeletionResult> deleteExpiredArchives(String tenantId) {
        return Flux.defer(() -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            return archiveDAO.findDueForDeletion(now, tenantId)
                    .filter(archive -> archive.isDueForDeletion(now))
                    .concatMap(archive -> deleteArchive(archive, now));
        });
    }

    private Mono<ArchiveDeletionResult> deleteArchive(Archive archive, OffsetDateTime now) {
        String archiveId = archive.getArchiveId();
        if (archive.getScheduledDeletion().approvalRequired()) {
            log.info("Archive {} is due for deletion but awaits approval", archiveId);
            return Mono.just(new ArchiveDeletionResult(archiveId, archive.getTenantId(), false, "Deletion requires approval"));
        }
        Map<String, Object> details = new HashMap<>();
        details.put("deleteAfter", archive.getScheduledDeletion().deleteAfter().toString());
        return storageRouter.delete(archive.getStorage().location(), archive.getStorage().path())
                .then(archiveDAO.delete(archiveId))
                .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId, ArchiveAuditAction.DELETED,
                        SYSTEM_ACTOR, now, details)))
                .then(auditService.record(ChainEventType.ARCHIVE_DELETED, ArchiveServiceImpl.archiveEvent(archive, SYSTEM_ACTOR)))
                .thenReturn(new ArchiveDeletionResult(archiveId, archive.getTenantId(), true, null))
                .doOnSuccess(r -> log.info("Expired archive {} of tenant {} deleted", archiveId, archive.getTenantId()))
                .onErrorResume(e -> {
                    log.error("Could not delete expired archive {}", archiveId, e);
                    return Mono.just(new ArchiveDeletionResult(archiveId, archive.getTenantId(), false, e.getMessage()));
                });
    }

    private static Map<String, Object> deletionEvent(RetentionPolicy policy, long count, DeletionSettings settings,
                                                     OffsetDateTime cutoff) {
        Map<String, Object> event = new HashMap<>();
        event.put("policyId", policy.getId().toString());
        event.put("tenantId", policy.getTenantId());
        event.put("dataType", policy.getDataType().getKey());
        event.put("deleted", count);
        event.put("softDelete", settings.softDelete());
        event.put("cutoff", cutoff.toString());
        return event;
    }
}
