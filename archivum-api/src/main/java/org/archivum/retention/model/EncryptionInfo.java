package org.archivum.retention.model;

public record EncryptionInfo(boolean enabled, String algorithm, String keyId) {

    public static EncryptionInfo none() {
        return new EncryptionInfo(false, null, null);
    }
}
