package org.archivum.retention.exception;

public class IntegrityException extends AbstractRetentionException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    public static IntegrityException checksumMismatch(String archiveId, String expected, String actual) {
        return new IntegrityException(String.format("Checksum mismatch for archive %s. Expected: %s, actual: %s",
                archiveId, expected, actual));
    }

    @Override
    public String getError() {
        return RetentionException.INTEGRITY;
    }
}
