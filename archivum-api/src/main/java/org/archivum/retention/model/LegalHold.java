package org.archivum.retention.model;

import java.time.OffsetDateTime;

public record LegalHold(boolean onHold, String reason, String placedBy, OffsetDateTime placedAt, OffsetDateTime releasedAt) {

    public static LegalHold none() {
        return new LegalHold(false, null, null, null, null);
    }

    public LegalHold release(OffsetDateTime at) {
        return new LegalHold(false, reason, placedBy, placedAt, at);
    }
}
