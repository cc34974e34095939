package org.archivum.retention.model;

public record EncryptionSettings(boolean enabled) {

    public static EncryptionSettings on() {
        return new EncryptionSettings(true);
    }

    public static EncryptionSettings off() {
        return new EncryptionSettings(false);
    }
}
