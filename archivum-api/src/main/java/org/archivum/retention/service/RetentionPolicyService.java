package org.archivum.retention.service;

import org.archivum.retention.dto.request.CreateRetentionPolicyRequest;
import org.archivum.retention.dto.request.UpdateRetentionPolicyRequest;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.model.ConfigurationChange;
import org.archivum.retention.model.RetentionPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface RetentionPolicyService {

    Mono<RetentionPolicy> createPolicy(String tenantId, CreateRetentionPolicyRequest request, String createdBy);

    /**
     * Applies the non-null fields of the request and records what changed in the configuration history.
     */
    Mono<RetentionPolicy> updatePolicy(String tenantId, UUID policyId, UpdateRetentionPolicyRequest request, String updatedBy);

    Mono<RetentionPolicy> getPolicy(String tenantId, UUID policyId);

    Flux<RetentionPolicy> getPolicies(String tenantId, PolicyStatus status, DataType dataType);

    Flux<ConfigurationChange> getConfigurationHistory(String tenantId, UUID policyId);
}
