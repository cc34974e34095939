package org.archivum.retention.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record DeletionSettings(boolean softDelete,
                               RetentionPeriod hardDeleteAfter,
                               boolean requireApproval,
                               List<String> approvers,
                               DeletionApproval approval) {

    public static DeletionSettings soft() {
        return new DeletionSettings(true, null, false, List.of(), null);
    }

    public static DeletionSettings hard() {
        return new DeletionSettings(false, null, false, List.of(), null);
    }

    /**
     * A hard delete may proceed when no approval is required, or when an approval was given by one of the approvers.
     */
    @JsonIgnore
    public boolean isHardDeleteApproved() {
        if (!requireApproval) {
            return true;
        }
        return approval != null
                && approval.approvedBy() != null
                && approvers != null
                && approvers.contains(approval.approvedBy());
    }
}
