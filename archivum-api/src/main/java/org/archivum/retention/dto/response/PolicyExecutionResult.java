package org.archivum.retention.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.archivum.retention.enums.DataType;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyExecutionResult(UUID policyId,
                                    String tenantId,
                                    DataType dataType,
                                    long processed,
                                    long archived,
                                    long deleted,
                                    long processingTime,
                                    ExecutionStatus status,
                                    String archiveId,
                                    String error) {

    public enum ExecutionStatus { SUCCESS, FAILED, SKIPPED }

    public static PolicyExecutionResult skipped(UUID policyId, String tenantId, DataType dataType, String reason) {
        return new PolicyExecutionResult(policyId, tenantId, dataType, 0, 0, 0, 0, ExecutionStatus.SKIPPED, null, reason);
    }

    public boolean success() {
        return status == ExecutionStatus.SUCCESS;
    }
}
