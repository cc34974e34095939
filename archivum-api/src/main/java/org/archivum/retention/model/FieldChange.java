package org.archivum.retention.model;

public record FieldChange(Object from, Object to) {
}
