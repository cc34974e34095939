package org.archivum.retention.dto.request;

import lombok.Builder;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.model.ArchivalSettings;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.ExecutionSchedule;
import org.archivum.retention.model.LegalRequirements;
import org.archivum.retention.model.RetentionPeriod;

/**
 * Partial update: null fields are left untouched.
 */
@Builder
public record UpdateRetentionPolicyRequest(String policyName,
                                           String description,
                                           RetentionPeriod retentionPeriod,
                                           ArchivalSettings archivalSettings,
                                           DeletionSettings deletionSettings,
                                           LegalRequirements legalRequirements,
                                           ExecutionSchedule executionSchedule,
                                           PolicyStatus status,
                                           String reason) {
}
