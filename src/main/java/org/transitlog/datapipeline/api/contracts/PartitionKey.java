package org.transitlog.datapipeline.api.contracts;

import java.nio.file.Path;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Identifies one archive partition: a calendar month in UTC.
 * <p>
 * A partition covers the half-open window {@code [periodStart, periodEnd)}. Its files live
 * under a Hive-style directory so that analytics engines can prune by path:
 * <pre>
 *   {archiveRoot}/year=2024/month=03/vehicle_positions.parquet
 * </pre>
 *
 * @param year  calendar year
 * @param month calendar month, 1-12
 */
public record PartitionKey(int year, int month) implements Comparable<PartitionKey> {

    public PartitionKey {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12, got " + month);
        }
    }

    /**
     * Returns the partition whose window contains the given instant.
     *
     * @param instant any instant
     * @return the UTC month containing {@code instant}
     */
    public static PartitionKey containing(Instant instant) {
        return of(YearMonth.from(instant.atOffset(ZoneOffset.UTC)));
    }

    public static PartitionKey of(YearMonth yearMonth) {
        return new PartitionKey(yearMonth.getYear(), yearMonth.getMonthValue());
    }

    public YearMonth toYearMonth() {
        return YearMonth.of(year, month);
    }

    /**
     * @return first instant of the month (inclusive)
     */
    public Instant periodStart() {
        return toYearMonth().atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    /**
     * @return first instant of the following month (exclusive)
     */
    public Instant periodEnd() {
        return next().periodStart();
    }

    public PartitionKey next() {
        return of(toYearMonth().plusMonths(1));
    }

    /**
     * Returns whether the instant lies inside this partition's window.
     *
     * @param instant instant to test
     * @return {@code true} if {@code periodStart <= instant < periodEnd}
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(periodStart()) && instant.isBefore(periodEnd());
    }

    /**
     * Resolves the partition directory below the archive root.
     *
     * @param archiveRoot the archive root directory
     * @return {@code archiveRoot/year=YYYY/month=MM}
     */
    public Path directory(Path archiveRoot) {
        return archiveRoot
            .resolve(String.format("year=%04d", year))
            .resolve(String.format("month=%02d", month));
    }

    @Override
    public int compareTo(PartitionKey other) {
        return toYearMonth().compareTo(other.toYearMonth());
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d", year, month);
    }
}
