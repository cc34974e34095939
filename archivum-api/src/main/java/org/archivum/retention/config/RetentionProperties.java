package org.archivum.retention.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for retention policy execution and archive storage.
 * Maps to archivum.retention.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "archivum.retention")
public class RetentionProperties {

    /**
     * Enable or disable the scheduled policy runs.
     */
    private boolean enabled = true;

    /**
     * Root directory of local archive blobs.
     */
    private String archiveBasePath = "./archives";

    /**
     * Zone used for calendar cutoffs and execution times.
     */
    private ZoneId zone = ZoneId.of("UTC");

    /**
     * Cron expression of the policy runner.
     * Default: every 15 minutes
     */
    private String executionCron = "0 */15 * * * ?";

    /**
     * Cron expression of the expired-archive cleanup.
     * Default: "0 30 2 * * ?" (daily at 2:30 AM)
     */
    private String archiveCleanupCron = "0 30 2 * * ?";

    /**
     * How long a policy run owns its (tenant, dataType) lease.
     */
    private Duration leaseDuration = Duration.ofMinutes(30);

    /**
     * Identifier of this instance in the lease table.
     */
    private String instanceId = "archivum-" + ProcessHandle.current().pid();
}
