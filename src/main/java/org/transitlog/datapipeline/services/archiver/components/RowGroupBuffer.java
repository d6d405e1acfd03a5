package org.transitlog.datapipeline.services.archiver.components;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.transitlog.datapipeline.api.archive.ArchiveIntegrityException;
import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.archive.IPartitionWriter;

/**
 * Component for batching new rows into row groups before they reach the partition writer.
 * <p>
 * Holds at most {@code capacity} rows. When the buffer fills up it is handed to the writer
 * as one batch and cleared; {@link #flush()} hands over whatever is left at the end of a
 * merge, including an empty batch.
 * <p>
 * Every hand-over is count-checked: a writer that reports a different number of written
 * rows than it received raises {@link ArchiveIntegrityException}.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. One buffer belongs to one merge.
 */
public class RowGroupBuffer {

    private final int capacity;
    private final IPartitionWriter writer;
    private final List<VehiclePosition> buffer;
    private long rowsFlushed = 0;
    private int rowGroupsFlushed = 0;

    /**
     * Creates a new row group buffer.
     *
     * @param capacity maximum number of rows per row group (must be positive)
     * @param writer   destination of full row groups
     * @throws IllegalArgumentException if capacity is not positive or writer is null
     */
    public RowGroupBuffer(int capacity, IPartitionWriter writer) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (writer == null) {
            throw new IllegalArgumentException("writer must not be null");
        }
        this.capacity = capacity;
        this.writer = writer;
        this.buffer = new ArrayList<>(Math.min(capacity, 65_536));
    }

    /**
     * Adds one row, writing the row group out if this row fills it.
     *
     * @param position row to add
     * @throws IOException             if the writer fails
     * @throws PartitionCodecException if the writer cannot encode the batch
     */
    public void add(VehiclePosition position) throws IOException, PartitionCodecException {
        buffer.add(position);
        if (buffer.size() >= capacity) {
            writeBuffer();
        }
    }

    /**
     * Writes the remaining rows (possibly none) to the writer.
     *
     * @throws IOException             if the writer fails
     * @throws PartitionCodecException if the writer cannot encode the batch
     */
    public void flush() throws IOException, PartitionCodecException {
        writeBuffer();
    }

    private void writeBuffer() throws IOException, PartitionCodecException {
        int expected = buffer.size();
        int written = writer.write(buffer);
        if (written != expected) {
            throw new ArchiveIntegrityException("Row group write to " + writer.getPath(), expected, written);
        }
        rowsFlushed += written;
        rowGroupsFlushed++;
        buffer.clear();
    }

    public int size() {
        return buffer.size();
    }

    public long getRowsFlushed() {
        return rowsFlushed;
    }

    public int getRowGroupsFlushed() {
        return rowGroupsFlushed;
    }
}
