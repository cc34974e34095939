package org.archivum.retention.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.service.RetentionDeletionService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes archives whose scheduled deletion date has passed. Archives on legal hold are kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "archivum.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredArchiveCleanupScheduler {

    private final RetentionDeletionService deletionService;

    @Scheduled(cron = "${archivum.retention.archive-cleanup-cron:0 30 2 * * ?}")
    public void cleanupExpiredArchives() {
        log.info("Starting expired archive cleanup");
        deletionService.deleteExpiredArchives(null)
                .filter(result -> result.deleted())
                .count()
                .doOnNext(count -> log.info("Expired archive cleanup completed: {} archives deleted", count))
                .doOnError(e -> log.error("Error during expired archive cleanup", e))
                .subscribe();
    }
}
