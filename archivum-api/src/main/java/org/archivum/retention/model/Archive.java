package org.archivum.retention.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.enums.DataType;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Metadata of one archival operation. The audit trail, access log and restoration history
 * live in their own append-only tables keyed by {@code archiveId}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Archive {

    private String archiveId;

    private String tenantId;

    private String sourceCollection;

    private DataType dataType;

    private UUID retentionPolicyId;

    private int recordCount;

    private DateRange dateRange;

    private ArchiveStorageInfo storage;

    private ArchiveFileInfo fileInfo;

    private CompressionInfo compression;

    private EncryptionInfo encryption;

    private ArchiveStatus status;

    @Builder.Default
    private boolean canRestore = true;

    @Builder.Default
    private LegalHold legalHold = LegalHold.none();

    @Builder.Default
    private ScheduledDeletion scheduledDeletion = ScheduledDeletion.none();

    private String createdBy;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    /**
     * Legal hold always wins over a scheduled deletion date.
     */
    public boolean isDueForDeletion(OffsetDateTime now) {
        if (legalHold != null && legalHold.onHold()) {
            return false;
        }
        if (scheduledDeletion == null || scheduledDeletion.deleteAfter() == null) {
            return false;
        }
        return !now.isBefore(scheduledDeletion.deleteAfter());
    }

    @JsonIgnore
    public boolean isEncrypted() {
        return encryption != null && encryption.enabled();
    }

    @JsonIgnore
    public boolean isCompressed() {
        return compression != null && compression.enabled();
    }
}
