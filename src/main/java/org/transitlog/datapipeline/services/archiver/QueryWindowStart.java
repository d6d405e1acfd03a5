package org.transitlog.datapipeline.services.archiver;

/**
 * Where a partition merge starts scanning the store.
 */
public enum QueryWindowStart {

    /**
     * Start at the smallest per-vehicle watermark of the existing partition, or at the
     * period start when there is none. Cheap on repeated runs, but a vehicle that has no
     * rows in the partition yet and whose first rows predate that watermark is missed.
     * Rows without a vehicle id from that watermark on are appended again by every run.
     */
    WATERMARK,

    /**
     * Always start at the period start. Rescans the whole month on every run; watermarks
     * still suppress rows that are already archived.
     * <p>
     * Rows without a vehicle id have no watermark and are appended again by every run,
     * so in this mode each such row of the month is duplicated per rerun.
     */
    PERIOD_START
}
