package org.archivum.retention.model;

import org.archivum.retention.enums.RetentionUnit;
import org.archivum.retention.exception.ConfigurationException;

public record RetentionPeriod(int value, RetentionUnit unit) {

    public RetentionPeriod {
        if (value <= 0) {
            throw new ConfigurationException("Retention period value must be positive, got " + value);
        }
        if (unit == null) {
            throw new ConfigurationException("Retention period unit is required");
        }
    }

    public static RetentionPeriod days(int value) {
        return new RetentionPeriod(value, RetentionUnit.DAYS);
    }

    public static RetentionPeriod months(int value) {
        return new RetentionPeriod(value, RetentionUnit.MONTHS);
    }

    public static RetentionPeriod years(int value) {
        return new RetentionPeriod(value, RetentionUnit.YEARS);
    }

    @Override
    public String toString() {
        return value + " " + unit.toValue();
    }
}
