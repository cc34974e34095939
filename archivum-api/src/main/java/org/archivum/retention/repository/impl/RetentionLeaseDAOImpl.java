package org.archivum.retention.repository.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.repository.RetentionLeaseDAO;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

import static org.archivum.retention.repository.SqlTableMapping.RETENTION_LEASES;

/**
 * Leases are rows keyed by (tenant_id, data_type). The upsert only takes over a row that is expired
 * or already owned by the caller, so exactly one instance sees a row count of 1.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionLeaseDAOImpl implements RetentionLeaseDAO {

    private static final String ACQUIRE = "INSERT INTO " + RETENTION_LEASES
            + " (tenant_id, data_type, holder, acquired_at, expires_at) VALUES (:tenantId, :dataType, :holder, :now, :expiresAt)"
            + " ON CONFLICT (tenant_id, data_type) DO UPDATE SET holder = EXCLUDED.holder,"
            + " acquired_at = EXCLUDED.acquired_at, expires_at = EXCLUDED.expires_at"
            + " WHERE " + RETENTION_LEASES + ".expires_at < EXCLUDED.acquired_at OR " + RETENTION_LEASES + ".holder = EXCLUDED.holder";

    private static final String RELEASE = "DELETE FROM " + RETENTION_LEASES
            + " WHERE tenant_id = :tenantId AND data_type = :dataType AND holder = :holder";

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Boolean> tryAcquire(String tenantId, DataType dataType, String holder, OffsetDateTime now,
                                    OffsetDateTime expiresAt) {
        return databaseClient.sql(ACQUIRE)
                .bind("tenantId", tenantId)
                .bind("dataType", dataType.name())
                .bind("holder", holder)
                .bind("now", now)
                .bind("expiresAt", expiresAt)
                .fetch()
                .rowsUpdated()
                .map(count -> count > 0)
                .doOnNext(acquired -> {
                    if (!acquired) {
                        log.debug("Lease for tenant {} and {} is held by another instance", tenantId, dataType);
                    }
                });
    }

    @Override
    public Mono<Void> release(String tenantId, DataType dataType, String holder) {
        return databaseClient.sql(RELEASE)
                .bind("tenantId", tenantId)
                .bind("dataType", dataType.name())
                .bind("holder", holder)
                .then();
    }
}
