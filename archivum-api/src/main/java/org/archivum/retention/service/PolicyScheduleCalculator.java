package org.archivum.retention.service;

import org.archivum.retention.config.RetentionProperties;
import org.archivum.retention.model.ExecutionSchedule;
import org.archivum.retention.model.RetentionPolicy;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

@Component
public class PolicyScheduleCalculator {

    private final ZoneId zone;

    public PolicyScheduleCalculator(RetentionProperties properties) {
        this.zone = properties.getZone();
    }

    /**
     * Today at the scheduled time, or the next slot of the frequency when that instant is not after {@code now}.
     */
    public OffsetDateTime calculateNextExecution(ExecutionSchedule schedule, OffsetDateTime now) {
        ExecutionSchedule effective = schedule != null ? schedule : ExecutionSchedule.defaultSchedule();
        ZonedDateTime local = now.atZoneSameInstant(zone);
        ZonedDateTime next = local.toLocalDate().atTime(effective.localTime()).atZone(zone);
        if (!next.isAfter(local)) {
            next = switch (effective.frequencyOrDefault()) {
                case DAILY -> next.plusDays(1);
                case WEEKLY -> next.plusWeeks(1);
                case MONTHLY -> next.plusMonths(1);
            };
        }
        return next.toOffsetDateTime();
    }

    public boolean isDueForExecution(RetentionPolicy policy, OffsetDateTime now) {
        return policy.isDueForExecution(now);
    }
}
