package org.archivum.retention.enums;

import lombok.Getter;

/**
 * Audit categories. Only immutable ones may be written to the hash chain.
 */
@Getter
public enum ImmutableCategory {
    ADMIN_ACTIONS("admin-actions", true),
    CROSS_TENANT_OPERATIONS("cross-tenant-ops", true),
    SECURITY_EVENTS("security-events", true),
    COMPLIANCE_EVENTS("compliance-events", true),
    SYSTEM_HEALTH("system-health", false),
    LICENSE_MANAGEMENT("license-mgmt", true),
    INFRASTRUCTURE_EVENTS("infrastructure", false);

    private final String fileName;
    private final boolean immutable;

    ImmutableCategory(String fileName, boolean immutable) {
        this.fileName = fileName;
        this.immutable = immutable;
    }

    public String logFileName() {
        return fileName + "-immutable.log";
    }

    public String stateFileName() {
        return fileName + "-chain.json";
    }
}
