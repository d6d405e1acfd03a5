package org.transitlog.datapipeline.api.resources.archive;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;

/**
 * Write access to a partition staging file.
 * <p>
 * Rows appear in the output in the order they were handed over: first an optional
 * {@link #copyFrom} of the existing partition, then the batches passed to {@link #write}.
 * Nothing is visible at {@link #getPath()} until {@link #finish()} returns.
 */
public interface IPartitionWriter extends AutoCloseable {

    /**
     * @return the staging file this writer produces
     */
    Path getPath();

    /**
     * Copies every row of an existing partition unmodified.
     *
     * @param reader the existing partition
     * @return number of rows copied
     * @throws IOException             if reading or writing fails
     * @throws PartitionCodecException if the source rows cannot be decoded
     */
    long copyFrom(IPartitionReader reader) throws IOException, PartitionCodecException;

    /**
     * Appends one row group.
     *
     * @param batch rows to write, possibly empty
     * @return number of rows written
     * @throws IOException             if writing fails
     * @throws PartitionCodecException if a row cannot be encoded
     */
    int write(List<VehiclePosition> batch) throws IOException, PartitionCodecException;

    /**
     * Flushes all rows into the staging file and closes it.
     *
     * @return number of rows in the finished file
     * @throws IOException             if the file cannot be written
     * @throws PartitionCodecException if encoding fails
     */
    long finish() throws IOException, PartitionCodecException;

    /**
     * Releases resources. Closing without {@link #finish()} discards the output.
     */
    @Override
    void close() throws IOException;
}
