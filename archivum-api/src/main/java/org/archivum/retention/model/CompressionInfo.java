package org.archivum.retention.model;

public record CompressionInfo(boolean enabled, String algorithm, int level) {
}
