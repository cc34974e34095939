package org.archivum.retention.service;

import org.archivum.retention.config.RetentionProperties;
import org.archivum.retention.enums.RetentionUnit;
import org.archivum.retention.model.RetentionPeriod;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Turns a retention period into the instant before which records are considered aged.
 * The calendar arithmetic is done in the configured zone so that "1 month" lands on the same
 * day of the previous month, clamped to month end.
 */
@Component
public class CutoffCalculator {

    private final ZoneId zone;

    public CutoffCalculator(RetentionProperties properties) {
        this.zone = properties.getZone();
    }

    public OffsetDateTime cutoff(RetentionPeriod period, OffsetDateTime now) {
        ZonedDateTime local = now.atZoneSameInstant(zone);
        ZonedDateTime cutoff = switch (period.unit()) {
            case DAYS -> local.minusDays(period.value());
            case MONTHS -> local.minusMonths(period.value());
            case YEARS -> local.minusYears(period.value());
        };
        return cutoff.toOffsetDateTime();
    }

    public OffsetDateTime cutoff(int value, String unit, OffsetDateTime now) {
        return cutoff(new RetentionPeriod(value, RetentionUnit.fromValue(unit)), now);
    }

    /**
     * Rough length of a period in days, for estimates only. Never used to select records.
     */
    public long approximateDays(RetentionPeriod period) {
        return switch (period.unit()) {
            case DAYS -> period.value();
            case MONTHS -> period.value() * 30L;
            case YEARS -> period.value() * 365L;
        };
    }
}
