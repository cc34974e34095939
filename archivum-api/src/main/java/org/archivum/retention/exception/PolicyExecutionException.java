package org.archivum.retention.exception;

import java.util.UUID;

/**
 * Failure of a single retention policy run.
 */
public class PolicyExecutionException extends AbstractRetentionException {

    public PolicyExecutionException(UUID policyId, Throwable cause) {
        super("Retention policy " + policyId + " failed: " + cause.getMessage(), cause);
    }

    @Override
    public String getError() {
        return RetentionException.POLICY_EXECUTION;
    }
}
