package org.transitlog.datapipeline.api.resources.database;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.database.dto.TimestampBounds;
import org.transitlog.datapipeline.api.resources.storage.CheckedConsumer;

/**
 * The transactional store that the feed ingestor appends to and the archiver reads from.
 * <p>
 * The archiver only ever calls the read methods. Every scan runs as one statement, so a
 * scan sees a consistent view while ingestion keeps appending.
 */
public interface IVehiclePositionStore extends AutoCloseable {

    /**
     * Creates the {@code vehicle_positions} table if it does not exist.
     *
     * @throws SQLException if the DDL fails
     */
    void createSchemaIfNotExists() throws SQLException;

    /**
     * Appends observations in one transaction.
     * <p>
     * Rows colliding with an existing row on {@code (trip_id, timestamp)} are ignored,
     * since the feed repeats positions between polls.
     *
     * @param positions rows to insert
     * @return number of rows actually stored
     * @throws SQLException if the insert fails; the transaction is rolled back
     */
    int append(List<VehiclePosition> positions) throws SQLException;

    /**
     * Finds the smallest and largest valid (strictly positive) timestamp.
     *
     * @return the bounds, or empty if the store holds no valid row
     * @throws SQLException if the query fails
     */
    Optional<TimestampBounds> findTimestampBounds() throws SQLException;

    /**
     * Streams all rows with {@code from <= timestamp < to} in timestamp order.
     *
     * @param from     inclusive lower bound
     * @param to       exclusive upper bound
     * @param consumer receives each row; an exception thrown here aborts the scan
     * @return number of rows handed to the consumer
     * @throws Exception if the query fails or the consumer throws
     */
    long scanPositions(Instant from, Instant to, CheckedConsumer<VehiclePosition> consumer) throws Exception;

    @Override
    void close();
}
