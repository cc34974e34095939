package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.dto.request.CreateRetentionPolicyRequest;
import org.archivum.retention.dto.request.UpdateRetentionPolicyRequest;
import org.archivum.retention.enums.ChainEventType;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.exception.ConfigurationException;
import org.archivum.retention.exception.ResourceNotFoundException;
import org.archivum.retention.model.ArchivalSettings;
import org.archivum.retention.model.ConfigurationChange;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.FieldChange;
import org.archivum.retention.model.LegalRequirements;
import org.archivum.retention.model.PolicyStatistics;
import org.archivum.retention.model.RetentionPeriod;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.repository.RetentionPolicyDAO;
import org.archivum.retention.service.CutoffCalculator;
import org.archivum.retention.service.PolicyScheduleCalculator;
import org.archivum.retention.service.RetentionAuditService;
import org.archivum.retention.service.RetentionPolicyService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionPolicyServiceImpl implements RetentionPolicyService {

    private static final String POLICY = "RetentionPolicy";

    private final RetentionPolicyDAO policyDAO;
    private final RecordStoreRegistry recordStoreRegistry;
    private final CutoffCalculator cutoffCalculator;
    private final PolicyScheduleCalculator scheduleCalculator;
    private final ArchiveStorageRouter storageRouter;
    private final RetentionAuditService auditService;
    private final Clock clock;

    @Override
    public Mono<RetentionPolicy> createPolicy(String tenantId, CreateRetentionPolicyRequest request, String createdBy) {
        return Mono.defer(() -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            RetentionPolicy policy = RetentionPolicy.builder()
                    .id(UUID.randomUUID())
                    .tenantId(tenantId)
                    .policyName(request.policyName())
                    .description(request.description())
                    .dataType(request.dataType())
                    .retentionPeriod(request.retentionPeriod())
                    .archivalSettings(request.archivalSettings() != null ? request.archivalSettings() : ArchivalSettings.disabled())
                    .deletionSettings(request.deletionSettings() != null ? request.deletionSettings() : DeletionSettings.soft())
                    .legalRequirements(request.legalRequirements())
                    .executionSchedule(request.executionSchedule())
                    .statistics(new PolicyStatistics())
                    .status(request.status() != null ? request.status() : PolicyStatus.ACTIVE)
                    .createdBy(createdBy)
                    .updatedBy(createdBy)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            validate(policy, now);
            policy.setNextExecution(scheduleCalculator.calculateNextExecution(policy.getExecutionSchedule(), now));

            return policyDAO.findByTenant(tenantId, null, policy.getDataType())
                    .hasElements()
                    .flatMap(exists -> {
                        if (exists) {
                            return Mono.error(new ConfigurationException("A retention policy for "
                                    + policy.getDataType().getKey() + " already exists for tenant " + tenantId));
                        }
                        return policyDAO.insert(policy);
                    })
                    .flatMap(saved -> auditService.record(ChainEventType.RETENTION_POLICY_CREATED, policyEvent(saved, createdBy))
                            .thenReturn(saved))
                    .doOnSuccess(saved -> log.info("Retention policy {} created for tenant {} ({})",
                            saved.getId(), tenantId, saved.getDataType().getKey()));
        });
    }

    @Override
    public Mono<RetentionPolicy> updatePolicy(String tenantId, UUID policyId, UpdateRetentionPolicyRequest request,
                                              String updatedBy) {
        return getPolicy(tenantId, policyId)
                .flatMap(existing -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    RetentionPolicy updated = applyUpdate(existing, request);
                    Map<String, FieldChange> changes = diff(existing, updated);
                    if (changes.isEmpty()) {
                        log.debug("Update of retention policy {} changed nothing", policyId);
                        return Mono.just(existing);
                    }
                    validate(updated, now);
                    if (changes.containsKey("executionSchedule") || changes.containsKey("status")) {
                        updated.setNextExecution(scheduleCalculator.calculateNextExecution(updated.getExecutionSchedule(), now));
                    }
                    updated.setUpdatedBy(updatedBy);
                    updated.setUpdatedAt(now);

                    ConfigurationChange change = new ConfigurationChange(policyId, updatedBy, now, request.reason(), changes);
                    Map<String, Object> event = policyEvent(updated, updatedBy);
                    event.put("changedFields", changes.keySet());
                    return policyDAO.update(updated)
                            .flatMap(saved -> policyDAO.appendConfigurationChange(change).thenReturn(saved))
                            .flatMap(saved -> auditService.record(ChainEventType.RETENTION_POLICY_UPDATED, event).thenReturn(saved))
                            .doOnSuccess(saved -> log.info("Retention policy {} updated by {}: {}", policyId, updatedBy, changes.keySet()));
                });
    }

    @Override
    public Mono<RetentionPolicy> getPolicy(String tenantId, UUID policyId) {
        return policyDAO.findById(tenantId, policyId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException(POLICY, policyId)));
    }

    @Override
    public Flux<RetentionPolicy> getPolicies(String tenantId, PolicyStatus status, DataType dataType) {
        return policyDAO.findByTenant(tenantId, status, dataType);
    }

    @Override
    public Flux<ConfigurationChange> getConfigurationHistory(String tenantId, UUID policyId) {
        return getPolicy(tenantId, policyId)
                .flatMapMany(policy -> policyDAO.getConfigurationHistory(policy.getId()));
    }

    private RetentionPolicy applyUpdate(RetentionPolicy existing, UpdateRetentionPolicyRequest request) {
        RetentionPolicy.RetentionPolicyBuilder builder = existing.toBuilder();
        if (request.policyName() != null) {
            builder.policyName(request.policyName());
        }
        if (request.description() != null) {
            builder.description(request.description());
        }
        if (request.retentionPeriod() != null) {
            builder.retentionPeriod(request.retentionPeriod());
        }
        if (request.archivalSettings() != null) {
            builder.archivalSettings(request.archivalSettings());
        }
        if (request.deletionSettings() != null) {
            builder.deletionSettings(request.deletionSettings());
        }
        if (request.legalRequirements() != null) {
            builder.legalRequirements(request.legalRequirements());
        }
        if (request.executionSchedule() != null) {
            builder.executionSchedule(request.executionSchedule());
        }
        if (request.status() != null) {
            builder.status(request.status());
        }
        return builder.build();
    }

    private Map<String, FieldChange> diff(RetentionPolicy before, RetentionPolicy after) {
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        putIfChanged(changes, "policyName", before.getPolicyName(), after.getPolicyName());
        putIfChanged(changes, "description", before.getDescription(), after.getDescription());
        putIfChanged(changes, "retentionPeriod", before.getRetentionPeriod(), after.getRetentionPeriod());
        putIfChanged(changes, "archivalSettings", before.getArchivalSettings(), after.getArchivalSettings());
        putIfChanged(changes, "deletionSettings", before.getDeletionSettings(), after.getDeletionSettings());
        putIfChanged(changes, "legalRequirements", before.getLegalRequirements(), after.getLegalRequirements());
        putIfChanged(changes, "executionSchedule", before.getExecutionSchedule(), after.getExecutionSchedule());
        putIfChanged(changes, "status", before.getStatus(), after.getStatus());
        return changes;
    }

    private static void putIfChanged(Map<String, FieldChange> changes, String field, Object from, Object to) {
        if (!Objects.equals(from, to)) {
            changes.put(field, new FieldChange(from, to));
        }
    }

    void validate(RetentionPolicy policy, OffsetDateTime now) {
        if (policy.getPolicyName() == null || policy.getPolicyName().isBlank()) {
            throw new ConfigurationException("Policy name is required");
        }
        if (!recordStoreRegistry.supports(policy.getDataType())) {
            throw new ConfigurationException("Unsupported data type: " + policy.getDataType());
        }
        RetentionPeriod retention = policy.getRetentionPeriod();
        if (retention == null) {
            throw new ConfigurationException("Retention period is required");
        }
        OffsetDateTime retentionCutoff = cutoffCalculator.cutoff(retention, now);

        LegalRequirements legal = policy.getLegalRequirements();
        if (legal != null) {
            if (legal.minRetention() != null && retentionCutoff.isAfter(cutoffCalculator.cutoff(legal.minRetention(), now))) {
                throw new ConfigurationException("Retention period " + retention
                        + " is shorter than the legal minimum " + legal.minRetention());
            }
            if (legal.maxRetention() != null && retentionCutoff.isBefore(cutoffCalculator.cutoff(legal.maxRetention(), now))) {
                throw new ConfigurationException("Retention period " + retention
                        + " exceeds the legal maximum " + legal.maxRetention());
            }
        }

        ArchivalSettings archival = policy.getArchivalSettings();
        if (archival != null && archival.enabled()) {
            if (archival.archiveAfter() == null) {
                throw new ConfigurationException("archiveAfter is required when archival is enabled");
            }
            if (!cutoffCalculator.cutoff(archival.archiveAfter(), now).isAfter(retentionCutoff)) {
                throw new ConfigurationException("archiveAfter " + archival.archiveAfter()
                        + " must be shorter than the retention period " + retention);
            }
            if (!storageRouter.supports(archival.locationOrDefault())) {
                throw new ConfigurationException("Archive location " + archival.locationOrDefault().toValue()
                        + " is not configured");
            }
        }

        DeletionSettings deletion = policy.getDeletionSettings();
        if (deletion != null && deletion.requireApproval() && (deletion.approvers() == null || deletion.approvers().isEmpty())) {
            throw new ConfigurationException("Deletion approval is required but no approvers are configured");
        }
        if (policy.getExecutionSchedule() != null) {
            policy.getExecutionSchedule().localTime();
        }
    }

    private static Map<String, Object> policyEvent(RetentionPolicy policy, String actor) {
        Map<String, Object> event = new HashMap<>();
        event.put("policyId", policy.getId().toString());
        event.put("tenantId", policy.getTenantId());
        event.put("dataType", policy.getDataType().getKey());
        event.put("policyName", policy.getPolicyName());
        event.put("retentionPeriod", policy.getRetentionPeriod().toString());
        event.put("status", policy.getStatus().name());
        event.put("actor", actor);
        return event;
    }
}
