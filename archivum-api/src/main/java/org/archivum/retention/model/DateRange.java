package org.archivum.retention.model;

import java.time.OffsetDateTime;
import java.util.Collection;

public record DateRange(OffsetDateTime start, OffsetDateTime end) {

    /**
     * Min and max record date of the given records, or an empty range when there are none.
     */
    public static DateRange of(Collection<TenantRecord> records) {
        OffsetDateTime start = null;
        OffsetDateTime end = null;
        for (TenantRecord record : records) {
            OffsetDateTime date = record.getRecordDate();
            if (date == null) {
                continue;
            }
            if (start == null || date.isBefore(start)) {
                start = date;
            }
            if (end == null || date.isAfter(end)) {
                end = date;
            }
        }
        return new DateRange(start, end);
    }
}
