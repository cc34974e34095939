package org.archivum.retention.service;

import org.archivum.retention.dto.response.PolicyExecutionResult;
import org.archivum.retention.model.RetentionPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface RetentionExecutionService {

    /**
     * Runs every active, due policy one after the other; all tenants when {@code tenantId} is null.
     * A failing policy is reported in its result and does not stop the run.
     */
    Flux<PolicyExecutionResult> executeRetentionPolicies(String tenantId);

    /**
     * Archives then deletes for one policy under its (tenant, dataType) lease and records the outcome
     * in the policy statistics. Failures are reported as a {@code FAILED} result.
     */
    Mono<PolicyExecutionResult> executePolicy(RetentionPolicy policy, OffsetDateTime now);

    /**
     * On-demand run of one policy, due or not. Fails with a policy execution error when the run fails.
     */
    Mono<PolicyExecutionResult> executePolicyNow(String tenantId, UUID policyId);
}
