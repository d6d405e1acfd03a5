package org.transitlog.datapipeline.api.archive;

/**
 * Thrown when rows cannot be decoded from or encoded into a partition file, or when a
 * store row cannot be converted into a {@link org.transitlog.datapipeline.api.contracts.VehiclePosition}.
 */
public class PartitionCodecException extends ArchiveException {

    public PartitionCodecException(String message) {
        super(message);
    }

    public PartitionCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
