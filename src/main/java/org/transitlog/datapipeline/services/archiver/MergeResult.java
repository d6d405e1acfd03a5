package org.transitlog.datapipeline.services.archiver;

import org.transitlog.datapipeline.api.contracts.PartitionKey;

/**
 * Outcome of merging one partition.
 *
 * @param partition       the month that was merged
 * @param existingRows    rows in the partition file before the merge (0 if there was none)
 * @param copiedRows      rows carried over from the existing file
 * @param newRows         rows appended from the store
 * @param skippedRows     store rows suppressed by a vehicle watermark
 * @param rejectedRows    store rows dropped for a timestamp that is not positive or lies outside the month
 * @param watermarks      number of vehicles with a watermark
 * @param totalRows       rows in the partition file after the merge
 */
public record MergeResult(
    PartitionKey partition,
    long existingRows,
    long copiedRows,
    long newRows,
    long skippedRows,
    long rejectedRows,
    int watermarks,
    long totalRows
) {
}
