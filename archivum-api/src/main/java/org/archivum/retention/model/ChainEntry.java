package org.archivum.retention.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ChainEntry(long index,
                         String timestamp,
                         String category,
                         String eventType,
                         JsonNode data,
                         String previousHash,
                         String hash) {
}
