package org.archivum.retention.exception;

public class RestoreException extends AbstractRetentionException {

    public RestoreException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return RetentionException.RESTORE;
    }
}
