package org.archivum.retention.model;

public record CompressionSettings(boolean enabled, int level) {

    public static final int DEFAULT_LEVEL = 6;

    public static CompressionSettings gzip() {
        return new CompressionSettings(true, DEFAULT_LEVEL);
    }

    public static CompressionSettings none() {
        return new CompressionSettings(false, DEFAULT_LEVEL);
    }
}
