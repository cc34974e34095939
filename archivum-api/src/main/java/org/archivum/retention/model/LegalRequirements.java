package org.archivum.retention.model;

public record LegalRequirements(RetentionPeriod minRetention,
                                RetentionPeriod maxRetention,
                                String jurisdiction,
                                String framework) {
}
