package org.archivum.retention.model;

import java.util.List;

/**
 * JSON body of an archive blob before compression and encryption.
 */
public record ArchiveDocument(ArchiveMetadata metadata, List<TenantRecord> records) {
}
