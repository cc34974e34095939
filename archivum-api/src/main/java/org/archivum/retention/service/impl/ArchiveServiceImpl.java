package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.dto.response.ArchiveVerificationResult;
import org.archivum.retention.enums.AccessType;
import org.archivum.retention.enums.ArchiveAuditAction;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.enums.ChainEventType;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.exception.ConfigurationException;
import org.archivum.retention.exception.IntegrityException;
import org.archivum.retention.exception.ResourceNotFoundException;
import org.archivum.retention.model.ArchivalSettings;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAccessEntry;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.ArchiveDocument;
import org.archivum.retention.model.ArchiveFileInfo;
import org.archivum.retention.model.ArchiveMetadata;
import org.archivum.retention.model.ArchiveStorageInfo;
import org.archivum.retention.model.CompressionInfo;
import org.archivum.retention.model.DateRange;
import org.archivum.retention.model.EncryptionInfo;
import org.archivum.retention.model.LegalHold;
import org.archivum.retention.model.RestorationEntry;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.model.ScheduledDeletion;
import org.archivum.retention.model.TenantRecord;
import org.archivum.retention.repository.ArchiveDAO;
import org.archivum.retention.repository.RecordStore;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.service.ArchiveCodec;
import org.archivum.retention.service.ArchiveService;
import org.archivum.retention.service.ArchiveStorage;
import org.archivum.retention.service.CutoffCalculator;
import org.archivum.retention.service.KeyCustodyService;
import org.archivum.retention.service.KeyCustodyService.DataKey;
import org.archivum.retention.service.RetentionAuditService;
import org.archivum.retention.utils.AesGcm;
import org.archivum.retention.utils.ArchiveIds;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.archivum.retention.model.RetentionPolicy.SYSTEM_ACTOR;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveServiceImpl implements ArchiveService {

    private static final String ARCHIVE = "Archive";
    private static final String JSON_EXTENSION = ".json";
    private static final String GZIP_EXTENSION = ".gz";
    private static final String ENCRYPTED_EXTENSION = ".enc";

    private final ArchiveDAO archiveDAO;
    private final RecordStoreRegistry recordStoreRegistry;
    private final CutoffCalculator cutoffCalculator;
    private final ArchiveCodec codec;
    private final KeyCustodyService keyCustodyService;
    private final ArchiveStorageRouter storageRouter;
    private final ArchiveContentLoader contentLoader;
    private final RetentionAuditService auditService;
    private final Clock clock;

    @Override
    public Mono<Archive> archiveExpiredRecords(RetentionPolicy policy, OffsetDateTime now) {
        ArchivalSettings settings = policy.archivalSettingsOrDefault();
        if (!settings.enabled() || settings.archiveAfter() == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            RecordStore store = recordStoreRegistry.resolve(policy.getDataType());
            OffsetDateTime retentionCutoff = cutoffCalculator.cutoff(policy.getRetentionPeriod(), now);
            OffsetDateTime archiveCutoff = cutoffCalculator.cutoff(settings.archiveAfter(), now);
            log.debug("Archive window for policy {}: [{}, {})", policy.getId(), retentionCutoff, archiveCutoff);
            return store.findArchivable(policy.getTenantId(), retentionCutoff, archiveCutoff)
                    .collectList()
                    .filter(records -> !records.isEmpty())
                    .flatMap(records -> createArchive(policy, records, now));
        });
    }

    @Override
    public Mono<Archive> createArchive(RetentionPolicy policy, List<TenantRecord> records, OffsetDateTime now) {
        ArchivalSettings settings = policy.archivalSettingsOrDefault();
        String archiveId = ArchiveIds.generate(now.toInstant().toEpochMilli());
        Mono<Optional<DataKey>> dataKey = settings.encryptionEnabled()
                ? keyCustodyService.createKey(policy.getTenantId()).map(Optional::of)
                : Mono.just(Optional.empty());

        return dataKey.flatMap(key -> {
            Archive pending = newArchive(archiveId, policy, records, settings, key.map(DataKey::keyId).orElse(null), now);
            ArchiveLocation location = pending.getStorage().location();
            String path = pending.getStorage().path();
            RecordStore store = recordStoreRegistry.resolve(policy.getDataType());
            List<UUID> recordIds = records.stream().map(TenantRecord::getId).toList();

            Mono<Archive> pipeline = Mono.fromCallable(() -> encode(pending, records, settings, key.orElse(null)))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(encoded -> storageRouter.write(location, path, encoded.content())
                            .then(archiveDAO.update(pending.toBuilder()
                                    .fileInfo(encoded.fileInfo())
                                    .status(ArchiveStatus.COMPLETED)
                                    .updatedAt(OffsetDateTime.now(clock))
                                    .build())))
                    .flatMap(completed -> store.markArchived(policy.getTenantId(), recordIds, archiveId)
                            .then(auditService.record(ChainEventType.ARCHIVE_CREATED, archiveEvent(completed, SYSTEM_ACTOR)))
                            .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId,
                                    ArchiveAuditAction.CREATED, SYSTEM_ACTOR, now, Map.of(
                                            "recordCount", completed.getRecordCount(),
                                            "checksum", completed.getFileInfo().checksum()))))
                            .thenReturn(completed))
                    .onErrorResume(e -> rollback(pending, store, e));

            return archiveDAO.insert(pending)
                    .onErrorResume(e -> discardKey(pending).then(Mono.<Archive>error(e)))
                    .then(pipeline)
                    .doOnSuccess(completed -> log.info("Archive {} created for tenant {}: {} {} records, {} bytes",
                            archiveId, policy.getTenantId(), completed.getRecordCount(), policy.getDataType().getKey(),
                            completed.getFileInfo().compressedSize()));
        });
    }

    private Archive newArchive(String archiveId, RetentionPolicy policy, List<TenantRecord> records,
                               ArchivalSettings settings, String keyId, OffsetDateTime now) {
        DataType dataType = policy.getDataType();
        return Archive.builder()
                .archiveId(archiveId)
                .tenantId(policy.getTenantId())
                .sourceCollection(dataType.getSourceCollection())
                .dataType(dataType)
                .retentionPolicyId(policy.getId())
                .recordCount(records.size())
                .dateRange(DateRange.of(records))
                .storage(new ArchiveStorageInfo(settings.locationOrDefault(), storagePath(policy.getTenantId(), dataType, archiveId, settings)))
                .compression(settings.compressionEnabled()
                        ? new CompressionInfo(true, ArchiveCodec.COMPRESSION_ALGORITHM, settings.compression().level())
                        : new CompressionInfo(false, null, 0))
                .encryption(keyId != null ? new EncryptionInfo(true, AesGcm.ALGORITHM, keyId) : EncryptionInfo.none())
                .status(ArchiveStatus.CREATING)
                .canRestore(true)
                .legalHold(LegalHold.none())
                .scheduledDeletion(ScheduledDeletion.none())
                .createdBy(SYSTEM_ACTOR)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    static String storagePath(String tenantId, DataType dataType, String archiveId, ArchivalSettings settings) {
        StringBuilder path = new StringBuilder(tenantId)
                .append(ArchiveStorage.FOLDER_SEPARATOR).append(dataType.getKey())
                .append(ArchiveStorage.FOLDER_SEPARATOR).append(archiveId).append(JSON_EXTENSION);
        if (settings.compressionEnabled()) {
            path.append(GZIP_EXTENSION);
        }
        if (settings.encryptionEnabled()) {
            path.append(ENCRYPTED_EXTENSION);
        }
        return path.toString();
    }

    private EncodedArchive encode(Archive archive, List<TenantRecord> records, ArchivalSettings settings, DataKey key) {
        ArchiveMetadata metadata = new ArchiveMetadata(archive.getArchiveId(), archive.getTenantId(), archive.getDataType(),
                archive.getSourceCollection(), archive.getRecordCount(), archive.getCreatedAt(), archive.getRetentionPolicyId());
        byte[] json = codec.serialize(new ArchiveDocument(metadata, records));
        byte[] compressed = settings.compressionEnabled() ? codec.compress(json, settings.compression().level()) : json;
        byte[] content = key != null ? codec.encrypt(compressed, key.secretKey()) : compressed;
        double ratio = json.length == 0 ? 1.0 : (double) compressed.length / json.length;
        String path = archive.getStorage().path();
        String format = path.substring(path.lastIndexOf(archive.getArchiveId()) + archive.getArchiveId().length() + 1);
        ArchiveFileInfo fileInfo = new ArchiveFileInfo(json.length, compressed.length, ratio, format,
                codec.checksum(content), ArchiveCodec.CHECKSUM_ALGORITHM);
        return new EncodedArchive(content, fileInfo);
    }

    private Mono<Archive> rollback(Archive pending, RecordStore store, Throwable error) {
        String archiveId = pending.getArchiveId();
        log.error("Archive {} failed, removing partial state", archiveId, error);
        return store.releaseArchived(pending.getTenantId(), archiveId)
                .then(storageRouter.delete(pending.getStorage().location(), pending.getStorage().path())
                        .onErrorResume(e -> {
                            log.warn("Could not remove blob of failed archive {}: {}", archiveId, e.getMessage());
                            return Mono.empty();
                        }))
                .then(discardKey(pending))
                .then(archiveDAO.delete(archiveId))
                .then(Mono.<Archive>error(error));
    }

    private Mono<Void> discardKey(Archive pending) {
        return pending.isEncrypted() ? keyCustodyService.discardKey(pending.getEncryption().keyId()) : Mono.empty();
    }

    @Override
    public Mono<Archive> getArchive(String tenantId, String archiveId) {
        return archiveDAO.findById(tenantId, archiveId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException(ARCHIVE, archiveId)));
    }

    @Override
    public Flux<Archive> getArchives(String tenantId, DataType dataType, ArchiveStatus status) {
        return archiveDAO.findByTenant(tenantId, dataType, status);
    }

    @Override
    public Mono<ArchiveDocument> getArchiveContent(String tenantId, String archiveId, String accessedBy) {
        return getArchive(tenantId, archiveId)
                .flatMap(archive -> contentLoader.loadDocument(archive)
                        .flatMap(document -> logAccess(archiveId, accessedBy, AccessType.VIEW).thenReturn(document)));
    }

    @Override
    public Mono<byte[]> downloadArchive(String tenantId, String archiveId, String accessedBy) {
        return getArchive(tenantId, archiveId)
                .flatMap(archive -> contentLoader.loadVerified(archive)
                        .flatMap(content -> logAccess(archiveId, accessedBy, AccessType.DOWNLOAD).thenReturn(content)));
    }

    @Override
    public Mono<Archive> placeLegalHold(String tenantId, String archiveId, String reason, String placedBy) {
        return getArchive(tenantId, archiveId)
                .flatMap(archive -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    archive.setLegalHold(new LegalHold(true, reason, placedBy, now, null));
                    archive.setUpdatedAt(now);
                    Map<String, Object> details = new HashMap<>();
                    details.put("reason", reason);
                    return archiveDAO.update(archive)
                            .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId,
                                    ArchiveAuditAction.LEGAL_HOLD_PLACED, placedBy, now, details)))
                            .then(auditService.record(ChainEventType.ARCHIVE_LEGAL_HOLD_CHANGED,
                                    legalHoldEvent(archive, placedBy, true, reason)))
                            .thenReturn(archive)
                            .doOnSuccess(a -> log.info("Legal hold placed on archive {} by {}", archiveId, placedBy));
                });
    }

    @Override
    public Mono<Archive> releaseLegalHold(String tenantId, String archiveId, String releasedBy) {
        return getArchive(tenantId, archiveId)
                .flatMap(archive -> {
                    if (archive.getLegalHold() == null || !archive.getLegalHold().onHold()) {
                        return Mono.just(archive);
                    }
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    archive.setLegalHold(archive.getLegalHold().release(now));
                    archive.setUpdatedAt(now);
                    return archiveDAO.update(archive)
                            .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId,
                                    ArchiveAuditAction.LEGAL_HOLD_RELEASED, releasedBy, now, Map.of())))
                            .then(auditService.record(ChainEventType.ARCHIVE_LEGAL_HOLD_CHANGED,
                                    legalHoldEvent(archive, releasedBy, false, null)))
                            .thenReturn(archive)
                            .doOnSuccess(a -> log.info("Legal hold released on archive {} by {}", archiveId, releasedBy));
                });
    }

    @Override
    public Mono<Archive> scheduleDeletion(String tenantId, String archiveId, OffsetDateTime deleteAfter,
                                          boolean approvalRequired, String requestedBy) {
        return getArchive(tenantId, archiveId)
                .flatMap(archive -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    archive.setScheduledDeletion(new ScheduledDeletion(deleteAfter, approvalRequired));
                    archive.setUpdatedAt(now);
                    Map<String, Object> details = new HashMap<>();
                    details.put("deleteAfter", deleteAfter != null ? deleteAfter.toString() : null);
                    details.put("approvalRequired", approvalRequired);
                    return archiveDAO.update(archive)
                            .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId,
                                    ArchiveAuditAction.DELETION_SCHEDULED, requestedBy, now, details)))
                            .thenReturn(archive);
                });
    }

    @Override
    public Mono<ArchiveVerificationResult> verifyArchive(String tenantId, String archiveId, String verifiedBy) {
        return getArchive(tenantId, archiveId)
                .flatMap(archive -> {
                    if (archive.getStatus() == ArchiveStatus.CREATING || archive.getStatus() == ArchiveStatus.FAILED) {
                        return Mono.error(new ConfigurationException("Archive " + archiveId + " is "
                                + archive.getStatus() + " and cannot be verified"));
                    }
                    String expected = archive.getFileInfo() != null ? archive.getFileInfo().checksum() : null;
                    return contentLoader.loadRaw(archive)
                            .map(contentLoader::checksum)
                            .flatMap(actual -> {
                                OffsetDateTime now = OffsetDateTime.now(clock);
                                boolean intact = actual.equals(expected);
                                archive.setStatus(intact ? ArchiveStatus.VERIFIED : ArchiveStatus.CORRUPTED);
                                archive.setUpdatedAt(now);
                                Map<String, Object> details = new HashMap<>();
                                details.put("expectedChecksum", expected);
                                details.put("actualChecksum", actual);
                                Mono<Void> recorded = archiveDAO.update(archive)
                                        .then(archiveDAO.appendAuditEntry(new ArchiveAuditEntry(archiveId,
                                                intact ? ArchiveAuditAction.VERIFIED : ArchiveAuditAction.CORRUPTED,
                                                verifiedBy, now, details)))
                                        .then(logAccess(archiveId, verifiedBy, AccessType.VERIFY));
                                if (!intact) {
                                    log.error("Archive {} is corrupted: expected checksum {}, actual {}", archiveId, expected, actual);
                                    return recorded.then(Mono.error(IntegrityException.checksumMismatch(archiveId, expected, actual)));
                                }
                                return recorded.thenReturn(new ArchiveVerificationResult(archiveId, ArchiveStatus.VERIFIED,
                                        expected, actual, now));
                            });
                });
    }

    @Override
    public Flux<ArchiveAuditEntry> getAuditTrail(String tenantId, String archiveId) {
        return getArchive(tenantId, archiveId).flatMapMany(archive -> archiveDAO.getAuditTrail(archiveId));
    }

    @Override
    public Flux<ArchiveAccessEntry> getAccessLog(String tenantId, String archiveId) {
        return getArchive(tenantId, archiveId).flatMapMany(archive -> archiveDAO.getAccessLog(archiveId));
    }

    @Override
    public Flux<RestorationEntry> getRestorationHistory(String tenantId, String archiveId) {
        return getArchive(tenantId, archiveId).flatMapMany(archive -> archiveDAO.getRestorationHistory(archiveId));
    }

    private Mono<Void> logAccess(String archiveId, String accessedBy, AccessType type) {
        return archiveDAO.appendAccessEntry(new ArchiveAccessEntry(archiveId, accessedBy, type,
                OffsetDateTime.now(clock), null, null));
    }

    static Map<String, Object> archiveEvent(Archive archive, String actor) {
        Map<String, Object> event = new HashMap<>();
        event.put("archiveId", archive.getArchiveId());
        event.put("tenantId", archive.getTenantId());
        event.put("dataType", archive.getDataType().getKey());
        event.put("recordCount", archive.getRecordCount());
        if (archive.getFileInfo() != null) {
            event.put("checksum", archive.getFileInfo().checksum());
        }
        event.put("actor", actor);
        return event;
    }

    private static Map<String, Object> legalHoldEvent(Archive archive, String actor, boolean onHold, String reason) {
        Map<String, Object> event = archiveEvent(archive, actor);
        event.put("onHold", onHold);
        if (reason != null) {
            event.put("reason", reason);
        }
        return event;
    }

    private record EncodedArchive(byte[] content, ArchiveFileInfo fileInfo) {}
}
