package org.archivum.retention.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.archivum.retention.exception.ConfigurationException;

public enum ArchiveLocation {
    LOCAL,
    CLOUD_STORAGE,
    BOTH;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    public boolean includesLocal() {
        return this != CLOUD_STORAGE;
    }

    public boolean includesCloud() {
        return this != LOCAL;
    }

    @JsonCreator
    public static ArchiveLocation fromValue(String value) {
        if (value != null) {
            for (ArchiveLocation location : values()) {
                if (location.name().equalsIgnoreCase(value)) {
                    return location;
                }
            }
        }
        throw new ConfigurationException("Unsupported archive location: " + value);
    }
}
