package org.archivum.retention.exception;

public abstract class AbstractRetentionException extends RuntimeException {

    public AbstractRetentionException(String message) {
        super(message);
    }

    public AbstractRetentionException(String message, Throwable cause) {
        super(message, cause);
    }

    public AbstractRetentionException(Throwable cause) {
        super(cause);
    }

    public abstract String getError();

}
