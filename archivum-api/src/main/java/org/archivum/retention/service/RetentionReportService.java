package org.archivum.retention.service;

import org.archivum.retention.dto.response.RetentionStatisticsReport;
import reactor.core.publisher.Mono;

public interface RetentionReportService {

    Mono<RetentionStatisticsReport> getRetentionStatistics(String tenantId);
}
