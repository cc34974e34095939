package org.archivum.retention.repository;

public interface SqlTableMapping {
    String RETENTION_POLICIES = "retention_policies";
    String POLICY_CONFIGURATION_HISTORY = "policy_configuration_history";
    String ARCHIVES = "archives";
    String ARCHIVE_AUDIT_TRAIL = "archive_audit_trail";
    String ARCHIVE_ACCESS_LOG = "archive_access_log";
    String ARCHIVE_RESTORATION_HISTORY = "archive_restoration_history";
    String ARCHIVE_KEYS = "archive_keys";
    String RETENTION_LEASES = "retention_leases";
}
