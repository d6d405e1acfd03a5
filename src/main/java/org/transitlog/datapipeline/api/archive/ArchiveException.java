package org.transitlog.datapipeline.api.archive;

/**
 * Base class for recoverable-by-rerun archive failures.
 * <p>
 * Any {@code ArchiveException} aborts the current partition merge and, through the
 * driver, the whole archive run. Nothing is retried automatically: the next run starts
 * over from range discovery and relies on partition watermarks to skip archived rows.
 * <p>
 * I/O failures are reported as {@link java.io.IOException} instead. Row-count mismatches
 * are not recoverable and are reported as {@link ArchiveIntegrityException}.
 */
public class ArchiveException extends Exception {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
