package org.archivum.retention.dto.response;

import org.archivum.retention.enums.ArchiveStatus;

import java.time.OffsetDateTime;

public record ArchiveVerificationResult(String archiveId,
                                        ArchiveStatus status,
                                        String expectedChecksum,
                                        String actualChecksum,
                                        OffsetDateTime verifiedAt) {
}
