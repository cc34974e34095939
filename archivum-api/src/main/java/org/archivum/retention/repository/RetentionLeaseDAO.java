package org.archivum.retention.repository;

import org.archivum.retention.enums.DataType;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

/**
 * Time-bounded ownership of a (tenant, dataType) pair across service instances.
 */
public interface RetentionLeaseDAO {

    /**
     * Emits true when the lease is free, expired, or already held by {@code holder}.
     */
    Mono<Boolean> tryAcquire(String tenantId, DataType dataType, String holder, OffsetDateTime now,
                             OffsetDateTime expiresAt);

    Mono<Void> release(String tenantId, DataType dataType, String holder);
}
