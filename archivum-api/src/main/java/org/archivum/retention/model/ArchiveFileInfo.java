package org.archivum.retention.model;

public record ArchiveFileInfo(long originalSize,
                              long compressedSize,
                              double compressionRatio,
                              String format,
                              String checksum,
                              String checksumAlgorithm) {
}
