package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import org.archivum.retention.dto.response.RetentionStatisticsReport;
import org.archivum.retention.dto.response.RetentionStatisticsReport.DataTypeArchiveStats;
import org.archivum.retention.dto.response.RetentionStatisticsReport.RecentExecution;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.ArchiveDAO;
import org.archivum.retention.repository.RetentionPolicyDAO;
import org.archivum.retention.service.CutoffCalculator;
import org.archivum.retention.service.RetentionReportService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class RetentionReportServiceImpl implements RetentionReportService {

    private static final int RECENT_EXECUTIONS = 10;

    private final RetentionPolicyDAO policyDAO;
    private final ArchiveDAO archiveDAO;
    private final CutoffCalculator cutoffCalculator;

    @Override
    public Mono<RetentionStatisticsReport> getRetentionStatistics(String tenantId) {
        return Mono.zip(policyDAO.findByTenant(tenantId, null, null).collectList(),
                        archiveDAO.findByTenant(tenantId, null, null).collectList())
                .map(tuple -> buildReport(tenantId, tuple.getT1(), tuple.getT2()));
    }

    private RetentionStatisticsReport buildReport(String tenantId, List<RetentionPolicy> policies, List<Archive> archives) {
        Map<DataType, Long> policiesByDataType = new EnumMap<>(DataType.class);
        Map<UUID, Long> estimatedRetentionDays = new LinkedHashMap<>();
        long active = 0;
        for (RetentionPolicy policy : policies) {
            policiesByDataType.merge(policy.getDataType(), 1L, Long::sum);
            if (policy.isActive()) {
                active++;
            }
            if (policy.getRetentionPeriod() != null) {
                estimatedRetentionDays.put(policy.getId(), cutoffCalculator.approximateDays(policy.getRetentionPeriod()));
            }
        }

        Map<DataType, DataTypeArchiveStats> archivesByDataType = new EnumMap<>(DataType.class);
        long totalRecords = 0;
        long totalSize = 0;
        for (Archive archive : archives) {
            long size = archive.getFileInfo() != null ? archive.getFileInfo().compressedSize() : 0;
            totalRecords += archive.getRecordCount();
            totalSize += size;
            archivesByDataType.merge(archive.getDataType(), new DataTypeArchiveStats(1, archive.getRecordCount(), size),
                    (current, added) -> current.add(added.records(), added.size()));
        }

        List<RecentExecution> recent = policies.stream()
                .filter(policy -> policy.getLastExecuted() != null)
                .sorted(Comparator.comparing(RetentionPolicy::getLastExecuted).reversed())
                .limit(RECENT_EXECUTIONS)
                .map(policy -> new RecentExecution(policy.getId(), policy.getPolicyName(), policy.getDataType(),
                        policy.getLastExecuted(),
                        policy.getStatistics() != null ? policy.getStatistics().getLastProcessedCount() : 0,
                        policy.getStatistics() != null && policy.getStatistics().getLastError() != null ? "failed" : "success"))
                .toList();

        return new RetentionStatisticsReport(tenantId, policies.size(), active, archives.size(), totalRecords, totalSize,
                policiesByDataType, archivesByDataType, recent, estimatedRetentionDays);
    }
}
