package org.archivum.retention.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.archivum.retention.exception.ConfigurationException;

/**
 * Logical categories of tenant data subject to retention, with the table that stores them
 * and the column that dates each record.
 */
@Getter
public enum DataType {
    AUDIT_LOGS("audit_logs", "AuditLog", "timestamp"),
    SECURITY_LOGS("security_logs", "SecurityEvent", "timestamp"),
    USER_DATA("user_data", "User", "created_at"),
    EMPLOYEE_RECORDS("employee_records", "EmployeeRecord", "created_at"),
    INSURANCE_POLICIES("insurance_policies", "InsurancePolicy", "created_at"),
    INSURANCE_CLAIMS("insurance_claims", "InsuranceClaim", "created_at"),
    FAMILY_MEMBERS("family_members", "FamilyMember", "created_at"),
    BENEFICIARIES("beneficiaries", "Beneficiary", "created_at"),
    LICENSE_DATA("license_data", "License", "created_at"),
    BACKUP_LOGS("backup_logs", "BackupLog", "created_at"),
    PERFORMANCE_LOGS("performance_logs", "PerformanceLog", "timestamp"),
    SYSTEM_LOGS("system_logs", "SystemLog", "timestamp"),
    COMPLIANCE_LOGS("compliance_logs", "ComplianceLog", "timestamp"),
    FINANCIAL_RECORDS("financial_records", "FinancialRecord", "created_at"),
    DOCUMENTS("documents", "Document", "created_at"),
    REPORTS("reports", "Report", "created_at");

    private final String key;
    private final String sourceCollection;
    private final String dateColumn;

    DataType(String key, String sourceCollection, String dateColumn) {
        this.key = key;
        this.sourceCollection = sourceCollection;
        this.dateColumn = dateColumn;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Table holding the live records of this data type.
     */
    public String getTableName() {
        return "retained_" + key;
    }

    @JsonCreator
    public static DataType fromKey(String key) {
        for (DataType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported data type: " + key);
    }
}
