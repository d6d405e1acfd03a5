package org.transitlog.datapipeline.services.archiver;

import java.sql.SQLException;
import java.util.Optional;

import org.transitlog.datapipeline.api.archive.ArchiveRangeException;
import org.transitlog.datapipeline.api.contracts.PartitionKey;
import org.transitlog.datapipeline.api.resources.database.IVehiclePositionStore;
import org.transitlog.datapipeline.api.resources.database.dto.TimestampBounds;

/**
 * Determines which months an archive run has to visit.
 * <p>
 * The range spans the months of the earliest and latest valid timestamps in the store.
 * It only bounds the loop; whether a month actually receives rows is decided per
 * partition by the merger's watermarks.
 */
public class ArchiveRangeFinder {

    /**
     * Computes the inclusive month range covered by valid store rows.
     *
     * @param store the transactional store
     * @return the range, or empty if the store holds no row with a positive timestamp
     * @throws ArchiveRangeException if the bounds cannot be read or are inconsistent
     */
    public Optional<MonthRange> computeRange(IVehiclePositionStore store) throws ArchiveRangeException {
        Optional<TimestampBounds> bounds;
        try {
            bounds = store.findTimestampBounds();
        } catch (SQLException e) {
            throw new ArchiveRangeException("Failed to query timestamp bounds: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ArchiveRangeException("Store returned malformed timestamp bounds: " + e.getMessage(), e);
        }
        if (bounds.isEmpty()) {
            return Optional.empty();
        }
        TimestampBounds b = bounds.get();
        if (b.earliest().getEpochSecond() <= 0) {
            throw new ArchiveRangeException("Store reported invalid earliest timestamp " + b.earliest());
        }
        return Optional.of(new MonthRange(PartitionKey.containing(b.earliest()), PartitionKey.containing(b.latest())));
    }
}
