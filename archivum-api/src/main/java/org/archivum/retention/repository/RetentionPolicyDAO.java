package org.archivum.retention.repository;

import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.model.ConfigurationChange;
import org.archivum.retention.model.RetentionPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface RetentionPolicyDAO {

    Mono<RetentionPolicy> insert(RetentionPolicy policy);

    Mono<RetentionPolicy> update(RetentionPolicy policy);

    Mono<RetentionPolicy> findById(String tenantId, UUID policyId);

    Flux<RetentionPolicy> findByTenant(String tenantId, PolicyStatus status, DataType dataType);

    /**
     * Active policies whose next execution is unset or not after {@code now}; all tenants when {@code tenantId} is null.
     */
    Flux<RetentionPolicy> findActiveDue(OffsetDateTime now, String tenantId);

    Mono<Void> appendConfigurationChange(ConfigurationChange change);

    Flux<ConfigurationChange> getConfigurationHistory(UUID policyId);
}
