package org.archivum.retention.dto.response;

public record ArchiveDeletionResult(String archiveId, String tenantId, boolean deleted, String error) {
}
