package org.archivum.retention.repository.impl;

import io.r2dbc.postgresql.codec.Json;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.enums.AccessType;
import org.archivum.retention.enums.ArchiveAuditAction;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.RestoreStatus;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAccessEntry;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.ArchiveFileInfo;
import org.archivum.retention.model.ArchiveStorageInfo;
import org.archivum.retention.model.CompressionInfo;
import org.archivum.retention.model.DateRange;
import org.archivum.retention.model.EncryptionInfo;
import org.archivum.retention.model.LegalHold;
import org.archivum.retention.model.RestorationEntry;
import org.archivum.retention.model.ScheduledDeletion;
import org.archivum.retention.repository.ArchiveDAO;
import org.archivum.retention.utils.JsonUtils;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.archivum.retention.repository.SqlTableMapping.ARCHIVES;
import static org.archivum.retention.repository.SqlTableMapping.ARCHIVE_ACCESS_LOG;
import static org.archivum.retention.repository.SqlTableMapping.ARCHIVE_AUDIT_TRAIL;
import static org.archivum.retention.repository.SqlTableMapping.ARCHIVE_RESTORATION_HISTORY;
import static org.archivum.retention.utils.SqlUtils.bindNullable;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveDAOImpl implements ArchiveDAO {

    private static final String SELECT_ARCHIVE = "SELECT archive_id, tenant_id, source_collection, data_type, "
            + "retention_policy_id, record_count, date_range_start, date_range_end, storage_location, storage_path, "
            + "file_info, compression, encryption, status, can_restore, legal_hold, delete_after, "
            + "deletion_approval_required, created_by, created_at, updated_at FROM " + ARCHIVES;

    private static final String INSERT_ARCHIVE = "INSERT INTO " + ARCHIVES
            + " (archive_id, tenant_id, source_collection, data_type, retention_policy_id, record_count, "
            + "date_range_start, date_range_end, storage_location, storage_path, file_info, compression, encryption, "
            + "status, can_restore, legal_hold, delete_after, deletion_approval_required, created_by, created_at, "
            + "updated_at) VALUES (:archiveId, :tenantId, :sourceCollection, :dataType, :retentionPolicyId, "
            + ":recordCount, :dateRangeStart, :dateRangeEnd, :storageLocation, :storagePath, :fileInfo, :compression, "
            + ":encryption, :status, :canRestore, :legalHold, :deleteAfter, :deletionApprovalRequired, :createdBy, "
            + ":createdAt, :updatedAt)";

    // identity columns and record_count are fixed at insert
    private static final String UPDATE_ARCHIVE = "UPDATE " + ARCHIVES
            + " SET storage_location = :storageLocation, storage_path = :storagePath, status = :status, "
            + "can_restore = :canRestore, legal_hold = :legalHold, delete_after = :deleteAfter, "
            + "deletion_approval_required = :deletionApprovalRequired, updated_at = :updatedAt, "
            + "file_info = :fileInfo WHERE archive_id = :archiveId";

    private final DatabaseClient databaseClient;

    private final JsonUtils jsonUtils;

    @Override
    public Mono<Archive> insert(Archive archive) {
        DatabaseClient.GenericExecuteSpec spec = bindMutable(databaseClient.sql(INSERT_ARCHIVE), archive)
                .bind("tenantId", archive.getTenantId())
                .bind("dataType", archive.getDataType().name())
                .bind("recordCount", archive.getRecordCount());
        spec = bindNullable(spec, "sourceCollection", archive.getSourceCollection(), String.class);
        spec = bindNullable(spec, "retentionPolicyId", archive.getRetentionPolicyId(), UUID.class);
        DateRange range = archive.getDateRange();
        spec = bindNullable(spec, "dateRangeStart", range != null ? range.start() : null, OffsetDateTime.class);
        spec = bindNullable(spec, "dateRangeEnd", range != null ? range.end() : null, OffsetDateTime.class);
        spec = bindNullable(spec, "compression", jsonUtils.toJson(archive.getCompression()), Json.class);
        spec = bindNullable(spec, "encryption", jsonUtils.toJson(archive.getEncryption()), Json.class);
        spec = bindNullable(spec, "createdBy", archive.getCreatedBy(), String.class);
        spec = bindNullable(spec, "createdAt", archive.getCreatedAt(), OffsetDateTime.class);
        return spec.then().thenReturn(archive);
    }

    @Override
    public Mono<Archive> update(Archive archive) {
        return bindMutable(databaseClient.sql(UPDATE_ARCHIVE), archive)
                .fetch()
                .rowsUpdated()
                .thenReturn(archive);
    }

    private DatabaseClient.GenericExecuteSpec bindMutable(DatabaseClient.GenericExecuteSpec spec, Archive archive) {
        ArchiveStorageInfo storage = archive.getStorage();
        ScheduledDeletion deletion = archive.getScheduledDeletion() != null
                ? archive.getScheduledDeletion() : ScheduledDeletion.none();
        spec = spec.bind("archiveId", archive.getArchiveId())
                .bind("status", archive.getStatus().name())
                .bind("canRestore", archive.isCanRestore())
                .bind("legalHold", jsonUtils.toJson(archive.getLegalHold() != null ? archive.getLegalHold() : LegalHold.none()))
                .bind("deletionApprovalRequired", deletion.approvalRequired());
        spec = bindNullable(spec, "storageLocation", storage != null && storage.location() != null
                ? storage.location().name() : null, String.class);
        spec = bindNullable(spec, "storagePath", storage != null ? storage.path() : null, String.class);
        spec = bindNullable(spec, "fileInfo", jsonUtils.toJson(archive.getFileInfo()), Json.class);
        spec = bindNullable(spec, "deleteAfter", deletion.deleteAfter(), OffsetDateTime.class);
        return bindNullable(spec, "updatedAt", archive.getUpdatedAt(), OffsetDateTime.class);
    }

    @Override
    public Mono<Archive> findById(String tenantId, String archiveId) {
        return databaseClient.sql(SELECT_ARCHIVE + " WHERE archive_id = :archiveId AND tenant_id = :tenantId")
                .bind("archiveId", archiveId)
                .bind("tenantId", tenantId)
                .map(this::mapArchive)
                .one();
    }

    @Override
    public Flux<Archive> findByTenant(String tenantId, DataType dataType, ArchiveStatus status) {
        StringBuilder sql = new StringBuilder(SELECT_ARCHIVE).append(" WHERE tenant_id = :tenantId");
        if (dataType != null) {
            sql.append(" AND data_type = :dataType");
        }
        if (status != null) {
            sql.append(" AND status = :status");
        }
        sql.append(" ORDER BY created_at DESC");
        DatabaseClient.GenericExecuteSpec query = databaseClient.sql(sql.toString()).bind("tenantId", tenantId);
        if (dataType != null) {
            query = query.bind("dataType", dataType.name());
        }
        if (status != null) {
            query = query.bind("status", status.name());
        }
        return query.map(this::mapArchive).all();
    }

    @Override
    public Flux<Archive> findByStatus(ArchiveStatus status) {
        return databaseClient.sql(SELECT_ARCHIVE + " WHERE status = :status")
                .bind("status", status.name())
                .map(this::mapArchive)
                .all();
    }

    @Override
    public Flux<Archive> findDueForDeletion(OffsetDateTime now, String tenantId) {
        String sql = SELECT_ARCHIVE + " WHERE delete_after IS NOT NULL AND delete_after <= :now"
                + " AND COALESCE((legal_hold ->> 'onHold')::boolean, false) = false"
                + (tenantId != null ? " AND tenant_id = :tenantId" : "");
        DatabaseClient.GenericExecuteSpec query = databaseClient.sql(sql).bind("now", now);
        if (tenantId != null) {
            query = query.bind("tenantId", tenantId);
        }
        return query.map(this::mapArchive).all();
    }

    @Override
    public Mono<Void> delete(String archiveId) {
        return databaseClient.sql("DELETE FROM " + ARCHIVES + " WHERE archive_id = :archiveId")
                .bind("archiveId", archiveId)
                .then();
    }

    @Override
    public Mono<Void> appendAuditEntry(ArchiveAuditEntry entry) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("INSERT INTO " + ARCHIVE_AUDIT_TRAIL
                        + " (archive_id, action, performed_by, performed_at, details) VALUES (:archiveId, :action, :performedBy, :performedAt, :details)")
                .bind("archiveId", entry.archiveId())
                .bind("action", entry.action().name())
                .bind("performedAt", entry.performedAt());
        spec = bindNullable(spec, "performedBy", entry.performedBy(), String.class);
        spec = bindNullable(spec, "details", jsonUtils.toJson(entry.details()), Json.class);
        return spec.then();
    }

    @Override
    public Mono<Void> appendAccessEntry(ArchiveAccessEntry entry) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("INSERT INTO " + ARCHIVE_ACCESS_LOG
                        + " (archive_id, accessed_by, access_type, accessed_at, ip_address, user_agent) "
                        + "VALUES (:archiveId, :accessedBy, :accessType, :accessedAt, :ipAddress, :userAgent)")
                .bind("archiveId", entry.archiveId())
                .bind("accessType", entry.accessType().name())
                .bind("accessedAt", entry.accessedAt());
        spec = bindNullable(spec, "accessedBy", entry.accessedBy(), String.class);
        spec = bindNullable(spec, "ipAddress", entry.ipAddress(), String.class);
        spec = bindNullable(spec, "userAgent", entry.userAgent(), String.class);
        return spec.then();
    }

    @Override
    public Mono<Void> appendRestoration(RestorationEntry entry) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("INSERT INTO " + ARCHIVE_RESTORATION_HISTORY
                        + " (archive_id, restored_at, restored_by, target_location, status, records_restored, notes) "
                        + "VALUES (:archiveId, :restoredAt, :restoredBy, :targetLocation, :status, :recordsRestored, :notes)")
                .bind("archiveId", entry.archiveId())
                .bind("restoredAt", entry.restoredAt())
                .bind("status", entry.status().name())
                .bind("recordsRestored", entry.recordsRestored());
        spec = bindNullable(spec, "restoredBy", entry.restoredBy(), String.class);
        spec = bindNullable(spec, "targetLocation", entry.targetLocation(), String.class);
        spec = bindNullable(spec, "notes", entry.notes(), String.class);
        return spec.then();
    }

    @Override
    public Flux<ArchiveAuditEntry> getAuditTrail(String archiveId) {
        return databaseClient.sql("SELECT archive_id, action, performed_by, performed_at, details FROM "
                        + ARCHIVE_AUDIT_TRAIL + " WHERE archive_id = :archiveId ORDER BY performed_at, id")
                .bind("archiveId", archiveId)
                .map(row -> new ArchiveAuditEntry(
                        row.get("archive_id", String.class),
                        ArchiveAuditAction.valueOf(row.get("action", String.class)),
                        row.get("performed_by", String.class),
                        row.get("performed_at", OffsetDateTime.class),
                        jsonUtils.toMap(row.get("details", Json.class))))
                .all();
    }

    @Override
    public Flux<ArchiveAccessEntry> getAccessLog(String archiveId) {
        return databaseClient.sql("SELECT archive_id, accessed_by, access_type, accessed_at, ip_address, user_agent FROM "
                        + ARCHIVE_ACCESS_LOG + " WHERE archive_id = :archiveId ORDER BY accessed_at, id")
                .bind("archiveId", archiveId)
                .map(row -> new ArchiveAccessEntry(
                        row.get("archive_id", String.class),
                        row.get("accessed_by", String.class),
                        AccessType.valueOf(row.get("access_type", String.class)),
                        row.get("accessed_at", OffsetDateTime.class),
                        row.get("ip_address", String.class),
                        row.get("user_agent", String.class)))
                .all();
    }

    @Override
    public Flux<RestorationEntry> getRestorationHistory(String archiveId) {
        return databaseClient.sql("SELECT archive_id, restored_at, restored_by, target_location, status, records_restored, notes FROM "
                        + ARCHIVE_RESTORATION_HISTORY + " WHERE archive_id = :archiveId ORDER BY restored_at, id")
                .bind("archiveId", archiveId)
                .map(row -> new RestorationEntry(
                        row.get("archive_id", String.class),
                        row.get("restored_at", OffsetDateTime.class),
                        row.get("restored_by", String.class),
                        row.get("target_location", String.class),
                        RestoreStatus.valueOf(row.get("status", String.class)),
                        row.get("records_restored", Integer.class),
                        row.get("notes", String.class)))
                .all();
    }

    private Archive mapArchive(Readable row) {
        String location = row.get("storage_location", String.class);
        Boolean approvalRequired = row.get("deletion_approval_required", Boolean.class);
        Boolean canRestore = row.get("can_restore", Boolean.class);
        return Archive.builder()
                .archiveId(row.get("archive_id", String.class))
                .tenantId(row.get("tenant_id", String.class))
                .sourceCollection(row.get("source_collection", String.class))
                .dataType(DataType.valueOf(row.get("data_type", String.class)))
                .retentionPolicyId(row.get("retention_policy_id", UUID.class))
                .recordCount(row.get("record_count", Integer.class))
                .dateRange(new DateRange(row.get("date_range_start", OffsetDateTime.class),
                        row.get("date_range_end", OffsetDateTime.class)))
                .storage(new ArchiveStorageInfo(location != null ? ArchiveLocation.valueOf(location) : null,
                        row.get("storage_path", String.class)))
                .fileInfo(jsonUtils.fromJson(row.get("file_info", Json.class), ArchiveFileInfo.class))
                .compression(jsonUtils.fromJson(row.get("compression", Json.class), CompressionInfo.class))
                .encryption(jsonUtils.fromJson(row.get("encryption", Json.class), EncryptionInfo.class))
                .status(ArchiveStatus.valueOf(row.get("status", String.class)))
                .canRestore(canRestore == null || canRestore)
                .legalHold(jsonUtils.fromJson(row.get("legal_hold", Json.class), LegalHold.class))
                .scheduledDeletion(new ScheduledDeletion(row.get("delete_after", OffsetDateTime.class),
                        approvalRequired != null && approvalRequired))
                .createdBy(row.get("created_by", String.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .updatedAt(row.get("updated_at", OffsetDateTime.class))
                .build();
    }
}
