package org.archivum.retention.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyStatistics {

    private long totalProcessed;

    private long totalArchived;

    private long totalDeleted;

    private long successCount;

    private long failureCount;

    private double avgProcessingTime;

    private long lastProcessedCount;

    private String lastError;

    /**
     * Merges a run into the running totals. Exactly one of the success or failure counters moves.
     */
    public void record(ExecutionOutcome outcome) {
        totalProcessed += outcome.processed();
        totalArchived += outcome.archived();
        totalDeleted += outcome.deleted();
        lastProcessedCount = outcome.processed();
        if (outcome.failed()) {
            failureCount++;
            lastError = outcome.error();
        } else {
            avgProcessingTime = (avgProcessingTime * successCount + outcome.processingTime()) / (successCount + 1);
            successCount++;
            lastError = null;
        }
    }
}
