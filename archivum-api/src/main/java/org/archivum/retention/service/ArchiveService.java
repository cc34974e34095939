package org.archivum.retention.service;

import org.archivum.retention.dto.response.ArchiveVerificationResult;
import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAccessEntry;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.ArchiveDocument;
import org.archivum.retention.model.RestorationEntry;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.model.TenantRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.List;

public interface ArchiveService {

    /**
     * Archives the records of the policy's archive window. Completes empty when archival is disabled
     * or the window holds no records.
     */
    Mono<Archive> archiveExpiredRecords(RetentionPolicy policy, OffsetDateTime now);

    /**
     * Writes the given records to a new archive. The archive row exists as {@code CREATING} before the
     * blob is written; on failure both are removed and the error is propagated.
     */
    Mono<Archive> createArchive(RetentionPolicy policy, List<TenantRecord> records, OffsetDateTime now);

    Mono<Archive> getArchive(String tenantId, String archiveId);

    Flux<Archive> getArchives(String tenantId, DataType dataType, ArchiveStatus status);

    Mono<ArchiveDocument> getArchiveContent(String tenantId, String archiveId, String accessedBy);

    Mono<byte[]> downloadArchive(String tenantId, String archiveId, String accessedBy);

    Mono<Archive> placeLegalHold(String tenantId, String archiveId, String reason, String placedBy);

    Mono<Archive> releaseLegalHold(String tenantId, String archiveId, String releasedBy);

    Mono<Archive> scheduleDeletion(String tenantId, String archiveId, OffsetDateTime deleteAfter,
                                   boolean approvalRequired, String requestedBy);

    /**
     * Recomputes the blob checksum. A mismatch marks the archive {@code CORRUPTED} and fails with an integrity error.
     */
    Mono<ArchiveVerificationResult> verifyArchive(String tenantId, String archiveId, String verifiedBy);

    Flux<ArchiveAuditEntry> getAuditTrail(String tenantId, String archiveId);

    Flux<ArchiveAccessEntry> getAccessLog(String tenantId, String archiveId);

    Flux<RestorationEntry> getRestorationHistory(String tenantId, String archiveId);
}
