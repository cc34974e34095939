package org.archivum.retention.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.dto.response.PolicyExecutionResult.ExecutionStatus;
import org.archivum.retention.service.RetentionExecutionService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs due retention policies of every tenant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "archivum.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetentionPolicyScheduler {

    private final RetentionExecutionService executionService;

    @Scheduled(cron = "${archivum.retention.execution-cron:0 */15 * * * ?}")
    public void executeDuePolicies() {
        log.debug("Starting scheduled retention policy execution");
        executionService.executeRetentionPolicies(null)
                .collectList()
                .doOnNext(results -> {
                    if (results.isEmpty()) {
                        log.debug("No retention policy was due");
                        return;
                    }
                    long failed = results.stream().filter(r -> r.status() == ExecutionStatus.FAILED).count();
                    long skipped = results.stream().filter(r -> r.status() == ExecutionStatus.SKIPPED).count();
                    log.info("Retention run finished: {} policies, {} failed, {} skipped", results.size(), failed, skipped);
                })
                .doOnError(e -> log.error("Retention policy execution failed", e))
                .subscribe();
    }
}
