package org.archivum.retention.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import io.r2dbc.postgresql.codec.Json;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.PolicyStatus;
import org.archivum.retention.model.ArchivalSettings;
import org.archivum.retention.model.ConfigurationChange;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.ExecutionSchedule;
import org.archivum.retention.model.FieldChange;
import org.archivum.retention.model.LegalRequirements;
import org.archivum.retention.model.PolicyStatistics;
import org.archivum.retention.model.RetentionPeriod;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.RetentionPolicyDAO;
import org.archivum.retention.utils.JsonUtils;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import static org.archivum.retention.repository.SqlTableMapping.POLICY_CONFIGURATION_HISTORY;
import static org.archivum.retention.repository.SqlTableMapping.RETENTION_POLICIES;
import static org.archivum.retention.utils.SqlUtils.bindNullable;
import static org.archivum.retention.utils.SqlUtils.isFirst;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionPolicyDAOImpl implements RetentionPolicyDAO {

    private static final TypeReference<Map<String, FieldChange>> CHANGES_TYPE = new TypeReference<>() {};

    private static final String SELECT_POLICY = "SELECT id, tenant_id, policy_name, description, data_type, retention_period, "
            + "archival_settings, deletion_settings, legal_requirements, execution_schedule, statistics, status, "
            + "next_execution, last_executed, created_by, updated_by, created_at, updated_at FROM " + RETENTION_POLICIES;

    private static final String INSERT_POLICY = "INSERT INTO " + RETENTION_POLICIES
            + " (id, tenant_id, policy_name, description, data_type, retention_period, archival_settings, deletion_settings, "
            + "legal_requirements, execution_schedule, statistics, status, next_execution, last_executed, created_by, "
            + "updated_by, created_at, updated_at) VALUES (:id, :tenantId, :policyName, :description, :dataType, "
            + ":retentionPeriod, :archivalSettings, :deletionSettings, :legalRequirements, :executionSchedule, "
            + ":statistics, :status, :nextExecution, :lastExecuted, :createdBy, :updatedBy, :createdAt, :updatedAt)";

    private static final String UPDATE_POLICY = "UPDATE " + RETENTION_POLICIES
            + " SET policy_name = :policyName, description = :description, retention_period = :retentionPeriod, "
            + "archival_settings = :archivalSettings, deletion_settings = :deletionSettings, "
            + "legal_requirements = :legalRequirements, execution_schedule = :executionSchedule, "
            + "statistics = :statistics, status = :status, next_execution = :nextExecution, "
            + "last_executed = :lastExecuted, updated_by = :updatedBy, updated_at = :updatedAt "
            + "WHERE id = :id AND tenant_id = :tenantId";

    private final DatabaseClient databaseClient;

    private final JsonUtils jsonUtils;

    @Override
    public Mono<RetentionPolicy> insert(RetentionPolicy policy) {
        DatabaseClient.GenericExecuteSpec spec = bindPolicy(databaseClient.sql(INSERT_POLICY), policy)
                .bind("dataType", policy.getDataType().name());
        spec = bindNullable(spec, "createdBy", policy.getCreatedBy(), String.class);
        spec = bindNullable(spec, "createdAt", policy.getCreatedAt(), OffsetDateTime.class);
        return spec.then().thenReturn(policy);
    }

    @Override
    public Mono<RetentionPolicy> update(RetentionPolicy policy) {
        return bindPolicy(databaseClient.sql(UPDATE_POLICY), policy)
                .fetch()
                .rowsUpdated()
                .doOnNext(count -> log.debug("Updated {} retention policy row(s) for {}", count, policy.getId()))
                .thenReturn(policy);
    }

    private DatabaseClient.GenericExecuteSpec bindPolicy(DatabaseClient.GenericExecuteSpec spec, RetentionPolicy policy) {
        spec = spec.bind("id", policy.getId())
                .bind("tenantId", policy.getTenantId())
                .bind("policyName", policy.getPolicyName())
                .bind("retentionPeriod", jsonUtils.toJson(policy.getRetentionPeriod()))
                .bind("statistics", jsonUtils.toJson(policy.getStatistics()))
                .bind("status", policy.getStatus().name());
        spec = bindNullable(spec, "description", policy.getDescription(), String.class);
        spec = bindNullable(spec, "archivalSettings", jsonUtils.toJson(policy.getArchivalSettings()), Json.class);
        spec = bindNullable(spec, "deletionSettings", jsonUtils.toJson(policy.getDeletionSettings()), Json.class);
        spec = bindNullable(spec, "legalRequirements", jsonUtils.toJson(policy.getLegalRequirements()), Json.class);
        spec = bindNullable(spec, "executionSchedule", jsonUtils.toJson(policy.getExecutionSchedule()), Json.class);
        spec = bindNullable(spec, "nextExecution", policy.getNextExecution(), OffsetDateTime.class);
        spec = bindNullable(spec, "lastExecuted", policy.getLastExecuted(), OffsetDateTime.class);
        spec = bindNullable(spec, "updatedBy", policy.getUpdatedBy(), String.class);
        return bindNullable(spec, "updatedAt", policy.getUpdatedAt(), OffsetDateTime.class);
    }

    @Override
    public Mono<RetentionPolicy> findById(String tenantId, UUID policyId) {
        return databaseClient.sql(SELECT_POLICY + " WHERE id = :id AND tenant_id = :tenantId")
                .bind("id", policyId)
                .bind("tenantId", tenantId)
                .map(this::mapPolicy)
                .one();
    }

    @Override
    public Flux<RetentionPolicy> findByTenant(String tenantId, PolicyStatus status, DataType dataType) {
        StringBuilder sql = new StringBuilder(SELECT_POLICY).append(" WHERE tenant_id = :tenantId");
        if (status != null) {
            sql.append(" AND status = :status");
        }
        if (dataType != null) {
            sql.append(" AND data_type = :dataType");
        }
        sql.append(" ORDER BY created_at DESC");
        DatabaseClient.GenericExecuteSpec query = databaseClient.sql(sql.toString()).bind("tenantId", tenantId);
        if (status != null) {
            query = query.bind("status", status.name());
        }
        if (dataType != null) {
            query = query.bind("dataType", dataType.name());
        }
        return query.map(this::mapPolicy).all();
    }

    @Override
    public Flux<RetentionPolicy> findActiveDue(OffsetDateTime now, String tenantId) {
        StringBuilder sql = new StringBuilder(SELECT_POLICY);
        boolean first = isFirst(true, sql);
        sql.append("status = :status AND (next_execution IS NULL OR next_execution <= :now)");
        if (tenantId != null) {
            isFirst(first, sql);
            sql.append("tenant_id = :tenantId");
        }
        sql.append(" ORDER BY next_execution NULLS FIRST, created_at");
        DatabaseClient.GenericExecuteSpec query = databaseClient.sql(sql.toString())
                .bind("status", PolicyStatus.ACTIVE.name())
                .bind("now", now);
        if (tenantId != null) {
            query = query.bind("tenantId", tenantId);
        }
        return query.map(this::mapPolicy).all();
    }

    @Override
    public Mono<Void> appendConfigurationChange(ConfigurationChange change) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("INSERT INTO " + POLICY_CONFIGURATION_HISTORY
                        + " (policy_id, changed_by, changed_at, reason, changes) VALUES (:policyId, :changedBy, :changedAt, :reason, :changes)")
                .bind("policyId", change.policyId())
                .bind("changedAt", change.changedAt())
                .bind("changes", jsonUtils.toJson(change.changes()));
        spec = bindNullable(spec, "changedBy", change.changedBy(), String.class);
        spec = bindNullable(spec, "reason", change.reason(), String.class);
        return spec.then();
    }

    @Override
    public Flux<ConfigurationChange> getConfigurationHistory(UUID policyId) {
        return databaseClient.sql("SELECT policy_id, changed_by, changed_at, reason, changes FROM "
                        + POLICY_CONFIGURATION_HISTORY + " WHERE policy_id = :policyId ORDER BY changed_at, id")
                .bind("policyId", policyId)
                .map(row -> new ConfigurationChange(
                        row.get("policy_id", UUID.class),
                        row.get("changed_by", String.class),
                        row.get("changed_at", OffsetDateTime.class),
                        row.get("reason", String.class),
                        jsonUtils.fromJson(row.get("changes", Json.class), CHANGES_TYPE)))
                .all();
    }

    private RetentionPolicy mapPolicy(Readable row) {
        return RetentionPolicy.builder()
                .id(row.get("id", UUID.class))
                .tenantId(row.get("tenant_id", String.class))
                .policyName(row.get("policy_name", String.class))
                .description(row.get("description", String.class))
                .dataType(DataType.valueOf(row.get("data_type", String.class)))
                .retentionPeriod(jsonUtils.fromJson(row.get("retention_period", Json.class), RetentionPeriod.class))
                .archivalSettings(jsonUtils.fromJson(row.get("archival_settings", Json.class), ArchivalSettings.class))
                .deletionSettings(jsonUtils.fromJson(row.get("deletion_settings", Json.class), DeletionSettings.class))
                .legalRequirements(jsonUtils.fromJson(row.get("legal_requirements", Json.class), LegalRequirements.class))
                .executionSchedule(jsonUtils.fromJson(row.get("execution_schedule", Json.class), ExecutionSchedule.class))
                .statistics(jsonUtils.fromJson(row.get("statistics", Json.class), PolicyStatistics.class))
                .status(PolicyStatus.valueOf(row.get("status", String.class)))
                .nextExecution(row.get("next_execution", OffsetDateTime.class))
                .lastExecuted(row.get("last_executed", OffsetDateTime.class))
                .createdBy(row.get("created_by", String.class))
                .updatedBy(row.get("updated_by", String.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .updatedAt(row.get("updated_at", OffsetDateTime.class))
                .build();
    }
}
