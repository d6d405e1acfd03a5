package org.transitlog.datapipeline.api.archive;

/**
 * Signals that the archiver observed a row count it did not expect.
 * <p>
 * A writer reporting fewer or more rows than it was handed, or a copy phase that moved
 * a different number of rows than the existing partition holds, means the output can no
 * longer be trusted. This is an internal defect, not an operational error: it is a
 * {@link RuntimeException}, the archiver only cleans up and rethrows it, and the CLI terminates with a
 * dedicated exit code. The final partition file is not replaced when it is raised.
 */
public class ArchiveIntegrityException extends RuntimeException {

    private final long expectedRows;
    private final long actualRows;

    /**
     * Creates a new integrity violation.
     *
     * @param message      what was being counted
     * @param expectedRows number of rows that should have been processed
     * @param actualRows   number of rows that were reported
     */
    public ArchiveIntegrityException(String message, long expectedRows, long actualRows) {
        super(String.format("%s: expected %d rows, got %d", message, expectedRows, actualRows));
        this.expectedRows = expectedRows;
        this.actualRows = actualRows;
    }

    public long getExpectedRows() {
        return expectedRows;
    }

    public long getActualRows() {
        return actualRows;
    }
}
