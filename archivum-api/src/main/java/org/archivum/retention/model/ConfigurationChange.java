package org.archivum.retention.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * One row of a policy's configuration history.
 */
public record ConfigurationChange(UUID policyId,
                                  String changedBy,
                                  OffsetDateTime changedAt,
                                  String reason,
                                  Map<String, FieldChange> changes) {
}
