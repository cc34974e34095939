package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.RetentionProperties;
import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.model.Archive;
import org.archivum.retention.repository.ArchiveDAO;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.service.ArchiveReconciliationService;
import org.archivum.retention.service.KeyCustodyService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveReconciliationServiceImpl implements ArchiveReconciliationService {

    private final ArchiveDAO archiveDAO;
    private final ArchiveStorageRouter storageRouter;
    private final RecordStoreRegistry recordStoreRegistry;
    private final KeyCustodyService keyCustodyService;
    private final RetentionProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        reconcileIncompleteArchives()
                .count()
                .subscribe(count -> {
                    if (count > 0) {
                        log.warn("Removed {} incomplete archives left by an interrupted run", count);
                    }
                }, e -> log.error("Archive reconciliation failed", e));
    }

    @Override
    public Flux<String> reconcileIncompleteArchives() {
        return Flux.defer(() -> {
            // rows younger than a lease may belong to a run still in progress on another instance
            OffsetDateTime staleBefore = OffsetDateTime.now(clock).minus(properties.getLeaseDuration());
            return archiveDAO.findByStatus(ArchiveStatus.CREATING)
                    .filter(archive -> archive.getCreatedAt() == null || archive.getCreatedAt().isBefore(staleBefore))
                    .concatMap(this::remove);
        });
    }

    private Mono<String> remove(Archive archive) {
        String archiveId = archive.getArchiveId();
        Mono<Void> blob = archive.getStorage() != null && archive.getStorage().path() != null
                ? storageRouter.delete(archive.getStorage().location(), archive.getStorage().path())
                : Mono.empty();
        Mono<Long> records = recordStoreRegistry.supports(archive.getDataType())
                ? recordStoreRegistry.resolve(archive.getDataType()).releaseArchived(archive.getTenantId(), archiveId)
                : Mono.just(0L);
        Mono<Void> key = archive.isEncrypted() ? keyCustodyService.discardKey(archive.getEncryption().keyId()) : Mono.empty();
        return blob
                .onErrorResume(e -> {
                    log.warn("Could not remove blob of incomplete archive {}: {}", archiveId, e.getMessage());
                    return Mono.empty();
                })
                .then(records)
                .then(key)
                .then(archiveDAO.delete(archiveId))
                .thenReturn(archiveId)
                .doOnNext(id -> log.info("Incomplete archive {} of tenant {} removed", id, archive.getTenantId()));
    }
}
