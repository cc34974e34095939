package org.archivum.retention.model;

/**
 * What one policy run did, merged into {@link PolicyStatistics}.
 */
public record ExecutionOutcome(long processed, long archived, long deleted, long processingTime, String error) {

    public static ExecutionOutcome success(long archived, long deleted, long processingTime) {
        return new ExecutionOutcome(archived + deleted, archived, deleted, processingTime, null);
    }

    public static ExecutionOutcome failure(long archived, long deleted, long processingTime, String error) {
        return new ExecutionOutcome(archived + deleted, archived, deleted, processingTime,
                error != null ? error : "Unknown error");
    }

    public boolean failed() {
        return error != null;
    }
}
