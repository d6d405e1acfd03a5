package org.transitlog.datapipeline.services.archiver;

import java.util.List;
import java.util.Optional;

/**
 * Result of an archive run.
 *
 * @param range      months visited, empty for a run over a store without valid rows
 * @param partitions per-month merge results, in month order
 */
public record ArchiveSummary(Optional<MonthRange> range, List<MergeResult> partitions) {

    public static ArchiveSummary empty() {
        return new ArchiveSummary(Optional.empty(), List.of());
    }

    public long copiedRows() {
        return partitions.stream().mapToLong(MergeResult::copiedRows).sum();
    }

    public long newRows() {
        return partitions.stream().mapToLong(MergeResult::newRows).sum();
    }

    public long skippedRows() {
        return partitions.stream().mapToLong(MergeResult::skippedRows).sum();
    }
}
