package org.transitlog.datapipeline.api.archive;

/**
 * Thrown when the month range to archive cannot be determined from the store.
 * <p>
 * Raised before any partition is touched, so a failed discovery never leaves
 * staging files behind.
 */
public class ArchiveRangeException extends ArchiveException {

    public ArchiveRangeException(String message) {
        super(message);
    }

    public ArchiveRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
