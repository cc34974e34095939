package org.archivum.retention.exception;

/**
 * Raised for unsupported time units, data types, categories or inconsistent policy settings.
 */
public class ConfigurationException extends AbstractRetentionException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return RetentionException.CONFIGURATION;
    }
}
