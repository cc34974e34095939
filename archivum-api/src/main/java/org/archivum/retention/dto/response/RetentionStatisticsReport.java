package org.archivum.retention.dto.response;

import org.archivum.retention.enums.DataType;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RetentionStatisticsReport(String tenantId,
                                        long totalPolicies,
                                        long activePolicies,
                                        long totalArchives,
                                        long totalArchivedRecords,
                                        long totalArchiveSize,
                                        Map<DataType, Long> policiesByDataType,
                                        Map<DataType, DataTypeArchiveStats> archivesByDataType,
                                        List<RecentExecution> recentExecutions,
                                        Map<UUID, Long> estimatedRetentionDays) {

    public record DataTypeArchiveStats(long count, long records, long size) {

        public DataTypeArchiveStats add(long records, long size) {
            return new DataTypeArchiveStats(count + 1, this.records + records, this.size + size);
        }
    }

    public record RecentExecution(UUID policyId,
                                  String policyName,
                                  DataType dataType,
                                  OffsetDateTime lastExecuted,
                                  long lastProcessedCount,
                                  String status) {}
}
