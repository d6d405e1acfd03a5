package org.transitlog.datapipeline.services.archiver;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.transitlog.datapipeline.api.archive.ArchiveException;
import org.transitlog.datapipeline.api.archive.ArchiveIntegrityException;
import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.PartitionKey;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.archive.IPartitionFormat;
import org.transitlog.datapipeline.api.resources.archive.IPartitionReader;
import org.transitlog.datapipeline.api.resources.archive.IPartitionWriter;
import org.transitlog.datapipeline.api.resources.database.IVehiclePositionStore;
import org.transitlog.datapipeline.services.archiver.components.RowGroupBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges newly stored rows of one month into that month's partition file.
 * <p>
 * <strong>Flow:</strong>
 * <ol>
 *   <li>Open the existing partition, if any, and derive per-vehicle watermarks from it</li>
 *   <li>Copy the existing rows unmodified into a staging file next to it</li>
 *   <li>Scan the store from the query window start to the end of the month</li>
 *   <li>Append every row that is newer than its vehicle's watermark, in row groups</li>
 *   <li>Finish the staging file and rename it over the partition file</li>
 * </ol>
 * <p>
 * The existing partition file is never opened for writing: until the final rename it stays
 * readable and unchanged, so a process killed mid-merge leaves at most a stray staging file,
 * which the next merge of the month deletes.
 * <p>
 * A month without a partition file is written directly to its final path.
 * <p>
 * <strong>Thread Safety:</strong> Instances hold no per-merge state and may be reused for
 * sequential merges. Concurrent merges of the same month are not supported.
 */
public class PartitionMerger {

    private static final Logger log = LoggerFactory.getLogger(PartitionMerger.class);

    static final String STAGING_SUFFIX = ".tmp";

    private final IPartitionFormat format;
    private final int rowGroupSize;
    private final QueryWindowStart queryWindowStart;

    /**
     * @param format           partition file format
     * @param rowGroupSize     rows per row group handed to the writer
     * @param queryWindowStart where store scans start
     */
    public PartitionMerger(IPartitionFormat format, int rowGroupSize, QueryWindowStart queryWindowStart) {
        if (rowGroupSize <= 0) {
            throw new IllegalArgumentException("rowGroupSize must be positive");
        }
        this.format = format;
        this.rowGroupSize = rowGroupSize;
        this.queryWindowStart = queryWindowStart;
    }

    /**
     * Returns the final path of a partition file.
     *
     * @param archiveRoot archive root directory
     * @param partition   the month
     * @return {@code archiveRoot/year=YYYY/month=MM/<fileName>}
     */
    public Path partitionFile(Path archiveRoot, PartitionKey partition) {
        return partition.directory(archiveRoot).resolve(format.getFileName());
    }

    /**
     * Merges one month.
     *
     * @param store       source of new rows (read only)
     * @param archiveRoot archive root directory
     * @param partition   the month to merge
     * @return counters of the merge
     * @throws IOException              if a file cannot be created, read, written or renamed
     * @throws ArchiveException         if rows cannot be decoded or encoded
     * @throws ArchiveIntegrityException if a row count does not add up
     */
    public MergeResult merge(IVehiclePositionStore store, Path archiveRoot, PartitionKey partition)
            throws IOException, ArchiveException {
        Path finalPath = partitionFile(archiveRoot, partition);
        Path tmpPath = finalPath.resolveSibling(finalPath.getFileName() + STAGING_SUFFIX);
        Files.createDirectories(finalPath.getParent());
        removeStrayFiles(partition, finalPath, tmpPath);

        IPartitionReader reader = format.openExisting(finalPath).orElse(null);
        Path stagingPath = reader != null ? tmpPath : finalPath;
        MergeResult result;
        try {
            try (reader) {
                Map<String, Instant> watermarks = Collections.emptyMap();
                long existingRows = 0;
                if (reader != null) {
                    existingRows = reader.getRowCount();
                    log.info("{}: found {} rows in existing file", partition, existingRows);
                    watermarks = buildWatermarks(reader);
                    log.info("{}: found updates for {} vehicles", partition, watermarks.size());
                }
                result = writeStaging(store, partition, reader, existingRows, watermarks, stagingPath);
            }
            if (!stagingPath.equals(finalPath)) {
                replace(stagingPath, finalPath);
            }
        } catch (IOException | ArchiveException | RuntimeException e) {
            discardStaging(stagingPath, e);
            throw e;
        }
        return result;
    }

    private MergeResult writeStaging(IVehiclePositionStore store, PartitionKey partition, IPartitionReader reader,
                                     long existingRows, Map<String, Instant> watermarks, Path stagingPath)
            throws IOException, ArchiveException {
        try (IPartitionWriter writer = format.create(stagingPath)) {
            long copied = 0;
            if (reader != null) {
                copied = writer.copyFrom(reader);
                log.info("{}: copied {} rows from existing file", partition, copied);
                if (copied != existingRows) {
                    throw new ArchiveIntegrityException(partition + ": copy of existing partition", existingRows, copied);
                }
            }

            Instant from = queryStart(partition, watermarks);
            Instant to = partition.periodEnd();
            log.info("{}: querying data from {} to {}", partition, from, to);

            RowGroupBuffer buffer = new RowGroupBuffer(rowGroupSize, writer);
            Counters counters = new Counters();
            scanStore(store, partition, from, to, position -> {
                if (!position.hasValidTimestamp() || !partition.contains(position.timestamp())) {
                    counters.rejected++;
                    return;
                }
                Instant watermark = watermarks.get(position.vehicleId());
                if (watermark != null && !position.timestamp().isAfter(watermark)) {
                    counters.skipped++;
                    return;
                }
                counters.added++;
                buffer.add(position);
            });
            buffer.flush();
            log.info("{}: wrote {} new rows, skipped {} rows", partition, counters.added, counters.skipped);
            if (counters.rejected > 0) {
                log.warn("{}: ignored {} rows with a timestamp outside the partition", partition, counters.rejected);
            }

            long total = writer.finish();
            if (total != copied + counters.added) {
                throw new ArchiveIntegrityException(partition + ": finished partition file", copied + counters.added,
                    total);
            }
            return new MergeResult(partition, existingRows, copied, counters.added, counters.skipped,
                counters.rejected, watermarks.size(), total);
        }
    }

    /**
     * Reads the existing partition once and records, per vehicle, the latest timestamp
     * already archived. Rows without a vehicle id do not contribute.
     *
     * @param reader the existing partition
     * @return vehicle id to latest archived timestamp
     * @throws IOException             if the file cannot be read
     * @throws PartitionCodecException if a row cannot be decoded
     */
    Map<String, Instant> buildWatermarks(IPartitionReader reader) throws IOException, PartitionCodecException {
        Map<String, Instant> watermarks = new HashMap<>();
        reader.forEachRow(position -> {
            if (!position.hasVehicleId()) {
                return;
            }
            watermarks.merge(position.vehicleId(), position.timestamp(),
                (current, candidate) -> candidate.isAfter(current) ? candidate : current);
        });
        return watermarks;
    }

    /**
     * Computes the first instant the store scan has to cover.
     * <p>
     * With {@link QueryWindowStart#WATERMARK} this is the smallest watermark, so repeated runs
     * only rescan the tail of the month. The scan never starts before the period start.
     */
    Instant queryStart(PartitionKey partition, Map<String, Instant> watermarks) {
        Instant periodStart = partition.periodStart();
        if (queryWindowStart == QueryWindowStart.PERIOD_START || watermarks.isEmpty()) {
            return periodStart;
        }
        Instant min = Collections.min(watermarks.values());
        return min.isBefore(periodStart) ? periodStart : min;
    }

    private static void scanStore(IVehiclePositionStore store, PartitionKey partition, Instant from, Instant to,
                                  MergeStep step) throws IOException, ArchiveException {
        try {
            store.scanPositions(from, to, step::apply);
        } catch (IOException | ArchiveException | RuntimeException e) {
            throw e;
        } catch (SQLException e) {
            throw new PartitionCodecException(partition + ": failed to scan store rows: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new ArchiveException(partition + ": store scan failed: " + e.getMessage(), e);
        }
    }

    /**
     * Renames the staging file over the partition file.
     * <p>
     * Staging files are created in the partition directory, so the move stays on one
     * filesystem. If the filesystem still refuses an atomic move, a plain replacing move is
     * used, which can leave a truncated partition file if the process dies mid-move.
     */
    private static void replace(Path stagingPath, Path finalPath) throws IOException {
        try {
            Files.move(stagingPath, finalPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to non-atomic replace", finalPath);
            Files.move(stagingPath, finalPath, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Replaced {} with {}", finalPath, stagingPath);
    }

    private void removeStrayFiles(PartitionKey partition, Path finalPath, Path tmpPath) throws IOException {
        List<Path> candidates = new ArrayList<>();
        candidates.add(tmpPath);
        candidates.addAll(format.workFiles(tmpPath));
        candidates.addAll(format.workFiles(finalPath));
        for (Path candidate : candidates) {
            if (Files.deleteIfExists(candidate)) {
                log.warn("{}: removed leftover file from an interrupted run: {}", partition, candidate);
            }
        }
    }

    private static void discardStaging(Path stagingPath, Exception cause) {
        try {
            Files.deleteIfExists(stagingPath);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.warn("Failed to delete staging file {}: {}", stagingPath, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface MergeStep {
        void apply(VehiclePosition position) throws IOException, ArchiveException;
    }

    private static final class Counters {
        long added;
        long skipped;
        long rejected;
    }
}
