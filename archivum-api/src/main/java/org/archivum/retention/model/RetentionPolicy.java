package org.archivum.retention.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetentionPolicy {

    /**
     * Actor recorded on changes made by scheduled policy runs.
     */
    public static final String SYSTEM_ACTOR = "retention_policy";

    private UUID id;

    private String tenantId;

    private String policyName;

    private String description;

    private DataType dataType;

    private RetentionPeriod retentionPeriod;

    private ArchivalSettings archivalSettings;

    private DeletionSettings deletionSettings;

    private LegalRequirements legalRequirements;

    private ExecutionSchedule executionSchedule;

    @Builder.Default
    private PolicyStatistics statistics = new PolicyStatistics();

    @Builder.Default
    private PolicyStatus status = PolicyStatus.ACTIVE;

    private OffsetDateTime nextExecution;

    private OffsetDateTime lastExecuted;

    private String createdBy;

    private String updatedBy;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    public void updateStatistics(ExecutionOutcome outcome) {
        if (statistics == null) {
            statistics = new PolicyStatistics();
        }
        statistics.record(outcome);
    }

    public boolean isDueForExecution(OffsetDateTime now) {
        return nextExecution == null || !now.isBefore(nextExecution);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == PolicyStatus.ACTIVE;
    }

    public ArchivalSettings archivalSettingsOrDefault() {
        return archivalSettings != null ? archivalSettings : ArchivalSettings.disabled();
    }

    public DeletionSettings deletionSettingsOrDefault() {
        return deletionSettings != null ? deletionSettings : DeletionSettings.soft();
    }

    public ExecutionSchedule executionScheduleOrDefault() {
        return executionSchedule != null ? executionSchedule : ExecutionSchedule.defaultSchedule();
    }
}
