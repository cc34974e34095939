package org.archivum.retention.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.archivum.retention.exception.ConfigurationException;

public enum RetentionUnit {
    DAYS, MONTHS, YEARS;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RetentionUnit fromValue(String value) {
        if (value != null) {
            for (RetentionUnit unit : values()) {
                if (unit.name().equalsIgnoreCase(value)) {
                    return unit;
                }
            }
        }
        throw new ConfigurationException("Unsupported time unit: " + value);
    }
}
