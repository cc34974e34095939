package org.archivum.retention.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A live, tenant-scoped row of a retained data type.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TenantRecord {

    private UUID id;

    private String tenantId;

    private OffsetDateTime recordDate;

    private Map<String, Object> payload;

    private OffsetDateTime deletedAt;

    private String deletedBy;

    private String deletionReason;

    private String archiveId;

    /**
     * Copy without identity and storage-specific fields, ready to be inserted again.
     */
    public TenantRecord withoutIdentity() {
        return toBuilder()
                .id(null)
                .deletedAt(null)
                .deletedBy(null)
                .deletionReason(null)
                .archiveId(null)
                .build();
    }
}
