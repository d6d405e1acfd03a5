package org.transitlog.datapipeline.services.archiver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.transitlog.datapipeline.api.archive.ArchiveException;
import org.transitlog.datapipeline.api.contracts.PartitionKey;
import org.transitlog.datapipeline.api.resources.archive.IPartitionFormat;
import org.transitlog.datapipeline.api.resources.database.IVehiclePositionStore;
import org.transitlog.datapipeline.resources.archive.ParquetPartitionFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one archive pass: finds the month range once, then merges every month in order.
 * <p>
 * The first failing month ends the run. Months merged before the failure keep their new
 * partition files; there is no resume state, a rerun simply visits every month again.
 */
public class ArchiveDriver {

    private static final Logger log = LoggerFactory.getLogger(ArchiveDriver.class);

    private final ArchiveRangeFinder rangeFinder;
    private final PartitionMerger merger;

    public ArchiveDriver(ArchiveRangeFinder rangeFinder, PartitionMerger merger) {
        this.rangeFinder = rangeFinder;
        this.merger = merger;
    }

    /**
     * Creates a driver writing Parquet partitions as configured.
     *
     * @param settings archive settings
     * @return a driver
     */
    public static ArchiveDriver create(ArchiveSettings settings) {
        IPartitionFormat format = new ParquetPartitionFormat(
            settings.fileName(), settings.compression(), settings.rowGroupSize());
        return new ArchiveDriver(new ArchiveRangeFinder(),
            new PartitionMerger(format, settings.rowGroupSize(), settings.queryWindowStart()));
    }

    /**
     * Archives every month that holds valid store rows.
     *
     * @param store       the transactional store
     * @param archiveRoot archive root directory
     * @return per-month results
     * @throws IOException      if a partition file operation fails
     * @throws ArchiveException if the range cannot be determined or rows cannot be converted
     */
    public ArchiveSummary run(IVehiclePositionStore store, Path archiveRoot) throws IOException, ArchiveException {
        log.info("Archiving to {} ...", archiveRoot.toAbsolutePath());
        Optional<MonthRange> range = rangeFinder.computeRange(store);
        if (range.isEmpty()) {
            log.info("No vehicle positions with a valid timestamp, nothing to archive");
            return ArchiveSummary.empty();
        }
        log.info("Creating partitions from {} to {}", range.get().first(), range.get().last());

        List<MergeResult> results = new ArrayList<>();
        for (PartitionKey partition : range.get().months()) {
            log.info("Writing partition for {}", partition);
            try {
                MergeResult result = merger.merge(store, archiveRoot, partition);
                results.add(result);
                log.info("Created partition for {} ({} rows)", partition, result.totalRows());
            } catch (IOException | ArchiveException e) {
                log.error("Archiving {} failed: {}", partition, e.getMessage());
                throw e;
            }
        }

        ArchiveSummary summary = new ArchiveSummary(range, List.copyOf(results));
        log.info("Archived {} partitions: {} rows copied, {} new, {} skipped",
            results.size(), summary.copiedRows(), summary.newRows(), summary.skippedRows());
        return summary;
    }
}
