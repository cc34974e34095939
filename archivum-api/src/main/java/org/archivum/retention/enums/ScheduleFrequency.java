package org.archivum.retention.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.archivum.retention.exception.ConfigurationException;

public enum ScheduleFrequency {
    DAILY, WEEKLY, MONTHLY;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ScheduleFrequency fromValue(String value) {
        if (value != null) {
            for (ScheduleFrequency frequency : values()) {
                if (frequency.name().equalsIgnoreCase(value)) {
                    return frequency;
                }
            }
        }
        throw new ConfigurationException("Unsupported schedule frequency: " + value);
    }
}
