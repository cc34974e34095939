package org.archivum.retention.model;

import org.archivum.retention.enums.ArchiveLocation;

public record ArchivalSettings(boolean enabled,
                               RetentionPeriod archiveAfter,
                               ArchiveLocation location,
                               CompressionSettings compression,
                               EncryptionSettings encryption) {

    public static ArchivalSettings disabled() {
        return new ArchivalSettings(false, null, ArchiveLocation.LOCAL, CompressionSettings.none(), EncryptionSettings.off());
    }

    public boolean compressionEnabled() {
        return compression != null && compression.enabled();
    }

    public boolean encryptionEnabled() {
        return encryption != null && encryption.enabled();
    }

    public ArchiveLocation locationOrDefault() {
        return location != null ? location : ArchiveLocation.LOCAL;
    }
}
