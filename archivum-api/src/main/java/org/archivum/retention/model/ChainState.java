package org.archivum.retention.model;

public record ChainState(long index, String lastHash, String lastUpdate, long totalEntries) {

    public static ChainState empty() {
        return new ChainState(0, "", null, 0);
    }
}
