package org.transitlog.datapipeline.api.resources.database.dto;

import java.time.Instant;

/**
 * Earliest and latest valid observation timestamps in the store.
 *
 * @param earliest smallest timestamp greater than the epoch
 * @param latest   largest timestamp
 */
public record TimestampBounds(Instant earliest, Instant latest) {

    public TimestampBounds {
        if (earliest == null || latest == null) {
            throw new IllegalArgumentException("bounds must not be null");
        }
        if (latest.isBefore(earliest)) {
            throw new IllegalArgumentException(
                "latest (" + latest + ") is before earliest (" + earliest + ")");
        }
    }
}
