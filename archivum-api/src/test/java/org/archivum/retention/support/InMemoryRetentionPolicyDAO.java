package org.archivum.retention.support;

import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.model.ConfigurationChange;
import org.archivum.retention.model.PolicyStatistics;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.RetentionPolicyDAO;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class InMemoryRetentionPolicyDAO implements RetentionPolicyDAO {

    private final Map<UUID, RetentionPolicy> policies = new LinkedHashMap<>();
    private final List<ConfigurationChange> history = new ArrayList<>();

    public synchronized RetentionPolicy stored(UUID policyId) {
        RetentionPolicy policy = policies.get(policyId);
        return policy != null ? copy(policy) : null;
    }

    public synchronized void put(RetentionPolicy policy) {
        policies.put(policy.getId(), copy(policy));
    }

    @Override
    public Mono<RetentionPolicy> insert(RetentionPolicy policy) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                policies.put(policy.getId(), copy(policy));
                return policy;
            }
        });
    }

    @Override
    public Mono<RetentionPolicy> update(RetentionPolicy policy) {
        return insert(policy);
    }

    @Override
    public Mono<RetentionPolicy> findById(String tenantId, UUID policyId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                RetentionPolicy policy = policies.get(policyId);
                return policy != null && tenantId.equals(policy.getTenantId()) ? copy(policy) : null;
            }
        });
    }

    @Override
    public Flux<RetentionPolicy> findByTenant(String tenantId, PolicyStatus status, DataType dataType) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(policies.values().stream()
                        .filter(p -> tenantId.equals(p.getTenantId()))
                        .filter(p -> status == null || p.getStatus() == status)
                        .filter(p -> dataType == null || p.getDataType() == dataType)
                        .map(InMemoryRetentionPolicyDAO::copy)
                        .toList());
            }
        });
    }

    @Override
    public Flux<RetentionPolicy> findActiveDue(OffsetDateTime now, String tenantId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(policies.values().stream()
                        .filter(p -> tenantId == null || tenantId.equals(p.getTenantId()))
                        .filter(p -> p.getStatus() == PolicyStatus.ACTIVE)
                        .filter(p -> p.getNextExecution() == null || !p.getNextExecution().isAfter(now))
                        .map(InMemoryRetentionPolicyDAO::copy)
                        .toList());
            }
        });
    }

    @Override
    public Mono<Void> appendConfigurationChange(ConfigurationChange change) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                history.add(change);
            }
        });
    }

    @Override
    public Flux<ConfigurationChange> getConfigurationHistory(UUID policyId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(history.stream().filter(c -> policyId.equals(c.policyId())).toList());
            }
        });
    }

    private static RetentionPolicy copy(RetentionPolicy policy) {
        PolicyStatistics stats = policy.getStatistics();
        PolicyStatistics statsCopy = stats == null ? new PolicyStatistics() : new PolicyStatistics(stats.getTotalProcessed(),
                stats.getTotalArchived(), stats.getTotalDeleted(), stats.getSuccessCount(), stats.getFailureCount(),
                stats.getAvgProcessingTime(), stats.getLastProcessedCount(), stats.getLastError());
        return policy.toBuilder().statistics(statsCopy).build();
    }
}
