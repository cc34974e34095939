package org.archivum.retention.model;

import org.archivum.retention.enums.ArchiveLocation;

public record ArchiveStorageInfo(ArchiveLocation location, String path) {
}
