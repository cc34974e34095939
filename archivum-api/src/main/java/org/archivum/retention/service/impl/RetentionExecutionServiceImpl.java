package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.RetentionProperties;
import org.archivum.retention.dto.response.PolicyExecutionResult;
import org.archivum.retention.dto.response.PolicyExecutionResult.ExecutionStatus;
import org.archivum.retention.exception.PolicyExecutionException;
import org.archivum.retention.model.ExecutionOutcome;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.RetentionLeaseDAO;
import org.archivum.retention.repository.RetentionPolicyDAO;
import org.archivum.retention.service.ArchiveService;
import org.archivum.retention.service.PolicyScheduleCalculator;
import org.archivum.retention.service.RetentionDeletionService;
import org.archivum.retention.service.RetentionExecutionService;
import org.archivum.retention.service.RetentionPolicyService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionExecutionServiceImpl implements RetentionExecutionService {

    private final RetentionPolicyDAO policyDAO;
    private final RetentionPolicyService policyService;
    private final RetentionLeaseDAO leaseDAO;
    private final ArchiveService archiveService;
    private final RetentionDeletionService deletionService;
    private final PolicyScheduleCalculator scheduleCalculator;
    private final RetentionProperties properties;
    private final Clock clock;

    @Override
    public Flux<PolicyExecutionResult> executeRetentionPolicies(String tenantId) {
        return Flux.defer(() -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            return policyDAO.findActiveDue(now, tenantId)
                    .filter(policy -> policy.isActive() && scheduleCalculator.isDueForExecution(policy, now))
                    .concatMap(policy -> executePolicy(policy, now)
                            .onErrorResume(e -> {
                                log.error("Retention policy {} could not be executed", policy.getId(), e);
                                return Mono.just(failedResult(policy, 0, 0, 0, null, e));
                            }));
        });
    }

    @Override
    public Mono<PolicyExecutionResult> executePolicy(RetentionPolicy policy, OffsetDateTime now) {
        String holder = properties.getInstanceId();
        OffsetDateTime expiresAt = now.plus(properties.getLeaseDuration());
        return leaseDAO.tryAcquire(policy.getTenantId(), policy.getDataType(), holder, now, expiresAt)
                .flatMap(acquired -> {
                    if (!acquired) {
                        log.info("Retention policy {} skipped: {} of tenant {} is leased by another run",
                                policy.getId(), policy.getDataType().getKey(), policy.getTenantId());
                        return Mono.just(PolicyExecutionResult.skipped(policy.getId(), policy.getTenantId(),
                                policy.getDataType(), "Lease held by another instance"));
                    }
                    Mono<Void> release = leaseDAO.release(policy.getTenantId(), policy.getDataType(), holder);
                    // released on completion, error and cancellation alike
                    return Mono.usingWhen(Mono.just(holder),
                            h -> process(policy, now),
                            h -> release,
                            (h, e) -> release,
                            h -> release);
                });
    }

    private Mono<PolicyExecutionResult> process(RetentionPolicy policy, OffsetDateTime now) {
        long start = clock.millis();
        AtomicLong archived = new AtomicLong();
        AtomicReference<String> archiveId = new AtomicReference<>();
        log.info("Executing retention policy {} ({}) for tenant {}", policy.getId(), policy.getDataType().getKey(),
                policy.getTenantId());

        return archiveService.archiveExpiredRecords(policy, now)
                .doOnNext(archive -> {
                    archived.set(archive.getRecordCount());
                    archiveId.set(archive.getArchiveId());
                })
                .then(deletionService.deleteExpiredRecords(policy, now))
                .defaultIfEmpty(0L)
                .flatMap(deleted -> {
                    long elapsed = clock.millis() - start;
                    ExecutionOutcome outcome = ExecutionOutcome.success(archived.get(), deleted, elapsed);
                    PolicyExecutionResult result = new PolicyExecutionResult(policy.getId(), policy.getTenantId(),
                            policy.getDataType(), outcome.processed(), outcome.archived(), outcome.deleted(), elapsed,
                            ExecutionStatus.SUCCESS, archiveId.get(), null);
                    return recordOutcome(policy, outcome, now).thenReturn(result);
                })
                .onErrorResume(e -> {
                    long elapsed = clock.millis() - start;
                    log.error("Retention policy {} failed", policy.getId(), e);
                    ExecutionOutcome outcome = ExecutionOutcome.failure(archived.get(), 0, elapsed, e.getMessage());
                    return recordOutcome(policy, outcome, now)
                            .thenReturn(failedResult(policy, archived.get(), 0, elapsed, archiveId.get(), e));
                });
    }

    private Mono<RetentionPolicy> recordOutcome(RetentionPolicy policy, ExecutionOutcome outcome, OffsetDateTime now) {
        policy.updateStatistics(outcome);
        policy.setLastExecuted(now);
        policy.setNextExecution(scheduleCalculator.calculateNextExecution(policy.getExecutionSchedule(), now));
        policy.setUpdatedAt(now);
        return policyDAO.update(policy);
    }

    @Override
    public Mono<PolicyExecutionResult> executePolicyNow(String tenantId, UUID policyId) {
        return policyService.getPolicy(tenantId, policyId)
                .flatMap(policy -> executePolicy(policy, OffsetDateTime.now(clock)))
                .flatMap(result -> result.status() == ExecutionStatus.FAILED
                        ? Mono.error(new PolicyExecutionException(policyId, new IllegalStateException(result.error())))
                        : Mono.just(result));
    }

    private static PolicyExecutionResult failedResult(RetentionPolicy policy, long archived, long deleted, long elapsed,
                                                      String archiveId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new PolicyExecutionResult(policy.getId(), policy.getTenantId(), policy.getDataType(), archived + deleted,
                archived, deleted, elapsed, ExecutionStatus.FAILED, archiveId, message);
    }
}
