package org.archivum.retention.repository.impl;

import io.r2dbc.postgresql.codec.Json;
import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.TenantRecord;
import org.archivum.retention.repository.RecordStore;
import org.archivum.retention.utils.JsonUtils;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.UUID;

import static org.archivum.retention.utils.SqlUtils.bindNullable;

/**
 * {@link RecordStore} over the table of one {@link DataType}. Table and date column come from the enum,
 * never from user input.
 */
@Slf4j
public class TableRecordStore implements RecordStore {

    private final DataType dataType;
    private final DatabaseClient databaseClient;
    private final JsonUtils jsonUtils;

    private final String dateColumn;
    private final String selectColumns;

    public TableRecordStore(DataType dataType, DatabaseClient databaseClient, JsonUtils jsonUtils) {
        this.dataType = dataType;
        this.databaseClient = databaseClient;
        this.jsonUtils = jsonUtils;
        this.dateColumn = "\"" + dataType.getDateColumn() + "\"";
        this.selectColumns = "SELECT id, tenant_id, " + dateColumn
                + " AS record_date, payload, deleted_at, deleted_by, deletion_reason, archive_id FROM "
                + dataType.getTableName();
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public Flux<TenantRecord> findArchivable(String tenantId, OffsetDateTime from, OffsetDateTime before) {
        StringBuilder sql = new StringBuilder(selectColumns)
                .append(" WHERE tenant_id = :tenantId AND deleted_at IS NULL AND archive_id IS NULL AND ")
                .append(dateColumn).append(" < :before");
        if (from != null) {
            sql.append(" AND ").append(dateColumn).append(" >= :from");
        }
        sql.append(" ORDER BY ").append(dateColumn);

        DatabaseClient.GenericExecuteSpec query = databaseClient.sql(sql.toString())
                .bind("tenantId", tenantId)
                .bind("before", before);
        if (from != null) {
            query = query.bind("from", from);
        }
        return query.map(this::mapRecord).all();
    }

    @Override
    public Mono<Long> markArchived(String tenantId, Collection<UUID> recordIds, String archiveId) {
        if (recordIds.isEmpty()) {
            return Mono.just(0L);
        }
        return databaseClient.sql("UPDATE " + dataType.getTableName()
                        + " SET archive_id = :archiveId WHERE tenant_id = :tenantId AND id IN (:ids)")
                .bind("archiveId", archiveId)
                .bind("tenantId", tenantId)
                .bind("ids", recordIds)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> releaseArchived(String tenantId, String archiveId) {
        return databaseClient.sql("UPDATE " + dataType.getTableName()
                        + " SET archive_id = NULL WHERE tenant_id = :tenantId AND archive_id = :archiveId")
                .bind("tenantId", tenantId)
                .bind("archiveId", archiveId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> softDeleteOlderThan(String tenantId, OffsetDateTime cutoff, String deletedBy, String reason,
                                          OffsetDateTime deletedAt) {
        return databaseClient.sql("UPDATE " + dataType.getTableName()
                        + " SET deleted_at = :deletedAt, deleted_by = :deletedBy, deletion_reason = :reason"
                        + " WHERE tenant_id = :tenantId AND deleted_at IS NULL AND "
                        + dateColumn + " < :cutoff")
                .bind("deletedAt", deletedAt)
                .bind("deletedBy", deletedBy)
                .bind("reason", reason)
                .bind("tenantId", tenantId)
                .bind("cutoff", cutoff)
                .fetch()
                .rowsUpdated()
                .doOnNext(count -> log.debug("Soft deleted {} {} records for tenant {}", count, dataType.getKey(), tenantId));
    }

    @Override
    public Mono<Long> hardDeleteOlderThan(String tenantId, OffsetDateTime cutoff) {
        return databaseClient.sql("DELETE FROM " + dataType.getTableName()
                        + " WHERE tenant_id = :tenantId AND " + dateColumn + " < :cutoff")
                .bind("tenantId", tenantId)
                .bind("cutoff", cutoff)
                .fetch()
                .rowsUpdated()
                .doOnNext(count -> log.debug("Hard deleted {} {} records for tenant {}", count, dataType.getKey(), tenantId));
    }

    @Override
    public Mono<Long> purgeSoftDeletedBefore(String tenantId, OffsetDateTime deletedBefore) {
        return databaseClient.sql("DELETE FROM " + dataType.getTableName()
                        + " WHERE tenant_id = :tenantId AND deleted_at IS NOT NULL AND deleted_at < :before")
                .bind("tenantId", tenantId)
                .bind("before", deletedBefore)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<TenantRecord> insert(TenantRecord record) {
        TenantRecord toInsert = record.toBuilder().id(UUID.randomUUID()).build();
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("INSERT INTO " + dataType.getTableName()
                        + " (id, tenant_id, " + dateColumn + ", payload) VALUES (:id, :tenantId, :recordDate, :payload)")
                .bind("id", toInsert.getId())
                .bind("tenantId", toInsert.getTenantId());
        spec = bindNullable(spec, "recordDate", toInsert.getRecordDate(), OffsetDateTime.class);
        spec = bindNullable(spec, "payload", jsonUtils.toJson(toInsert.getPayload()), Json.class);
        return spec.then().thenReturn(toInsert);
    }

    private TenantRecord mapRecord(Readable row) {
        return TenantRecord.builder()
                .id(row.get("id", UUID.class))
                .tenantId(row.get("tenant_id", String.class))
                .recordDate(row.get("record_date", OffsetDateTime.class))
                .payload(jsonUtils.toMap(row.get("payload", Json.class)))
                .deletedAt(row.get("deleted_at", OffsetDateTime.class))
                .deletedBy(row.get("deleted_by", String.class))
                .deletionReason(row.get("deletion_reason", String.class))
                .archiveId(row.get("archive_id", String.class))
                .build();
    }
}
