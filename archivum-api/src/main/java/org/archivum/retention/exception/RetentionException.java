package org.archivum.retention.exception;

public interface RetentionException {

    String CONFIGURATION = "Configuration";
    String INTEGRITY = "Integrity";
    String NOT_FOUND = "NotFound";
    String POLICY_EXECUTION = "PolicyExecution";
    String RESTORE = "Restore";
    String STORAGE = "Storage";
}
