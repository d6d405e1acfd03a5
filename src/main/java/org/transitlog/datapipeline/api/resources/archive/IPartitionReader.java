package org.transitlog.datapipeline.api.resources.archive;

import java.io.IOException;
import java.nio.file.Path;

import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.storage.CheckedConsumer;

/**
 * Read access to an existing partition file.
 * <p>
 * A merge reads the file twice: once to derive per-vehicle watermarks and once to copy
 * it into the staging file. Every call to {@link #forEachRow} therefore starts again at
 * the first row.
 */
public interface IPartitionReader extends AutoCloseable {

    /**
     * @return the partition file this reader is bound to
     */
    Path getPath();

    /**
     * Returns the number of rows in the file as recorded in its footer.
     *
     * @return total row count
     * @throws IOException             if the file cannot be read
     * @throws PartitionCodecException if the footer is malformed
     */
    long getRowCount() throws IOException, PartitionCodecException;

    /**
     * Streams every row of the file, in file order, starting from the first row.
     *
     * @param consumer receives each row
     * @return number of rows read
     * @throws IOException             if the file cannot be read or the consumer fails with I/O
     * @throws PartitionCodecException if a row cannot be decoded
     */
    long forEachRow(CheckedConsumer<VehiclePosition> consumer) throws IOException, PartitionCodecException;

    @Override
    void close() throws IOException;
}
