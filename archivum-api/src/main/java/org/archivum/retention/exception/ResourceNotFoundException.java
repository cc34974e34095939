package org.archivum.retention.exception;

public class ResourceNotFoundException extends AbstractRetentionException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(resourceType + " not found : " + id);
    }

    @Override
    public String getError() {
        return RetentionException.NOT_FOUND;
    }
}
