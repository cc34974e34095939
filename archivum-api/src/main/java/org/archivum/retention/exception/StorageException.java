package org.archivum.retention.exception;

public class StorageException extends AbstractRetentionException {
    public StorageException(Throwable cause) {
        super(cause);
    }

    @Override
    public String getError() {
        return RetentionException.STORAGE;
    }

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
