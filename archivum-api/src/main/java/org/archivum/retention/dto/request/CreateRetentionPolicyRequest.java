package org.archivum.retention.dto.request;

import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.model.ArchivalSettings;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.ExecutionSchedule;
import org.archivum.retention.model.LegalRequirements;
import org.archivum.retention.model.RetentionPeriod;

public record CreateRetentionPolicyRequest(String policyName,
                                           String description,
                                           DataType dataType,
                                           RetentionPeriod retentionPeriod,
                                           ArchivalSettings archivalSettings,
                                           DeletionSettings deletionSettings,
                                           LegalRequirements legalRequirements,
                                           ExecutionSchedule executionSchedule,
                                           PolicyStatus status) {
}
