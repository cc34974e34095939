package org.archivum.retention.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.dto.response.ChainVerificationResult.ChainError;
import org.archivum.retention.service.ImmutableAuditChainService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "archivum.audit.chain.verification-enabled", havingValue = "true", matchIfMissing = true)
public class ImmutableChainVerificationScheduler {

    private final ImmutableAuditChainService chainService;

    @Scheduled(cron = "${archivum.audit.chain.verification-cron:0 0 3 * * ?}")
    public void verifyImmutableChains() {
        log.info("Starting scheduled immutable chain verification");
        chainService.verifyAll()
                .doOnNext(result -> {
                    if (result.valid()) {
                        log.info("Immutable chain {} verification passed: {} entries verified",
                                result.category(), result.totalEntries());
                        return;
                    }
                    log.warn("IMMUTABLE CHAIN INTEGRITY VIOLATION in {}: {} of {} entries invalid (score {})",
                            result.category(), result.invalidEntries(), result.totalEntries(), result.integrityScore());
                    for (ChainError error : result.errors()) {
                        log.warn("  line {} entry {}: {} expected={} actual={}", error.line(), error.entryIndex(),
                                error.reason(), error.expected(), error.actual());
                    }
                })
                .doOnError(e -> log.error("Immutable chain verification failed: {}", e.getMessage()))
                .subscribe();
    }
}
