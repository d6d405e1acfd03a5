package org.transitlog.datapipeline.resources.archive;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Shared DuckDB plumbing for the Parquet partition reader and writer.
 */
final class DuckDbSupport {

    // DuckDB driver loaded flag
    private static volatile boolean driverLoaded = false;

    private DuckDbSupport() {
    }

    /**
     * Loads the DuckDB JDBC driver (thread-safe, idempotent).
     */
    static synchronized void loadDriver() {
        if (!driverLoaded) {
            try {
                Class.forName("org.duckdb.DuckDBDriver");
                driverLoaded = true;
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("DuckDB driver not found on classpath", e);
            }
        }
    }

    /**
     * Opens a private in-memory DuckDB instance.
     */
    static Connection openInMemory() throws SQLException {
        loadDriver();
        return DriverManager.getConnection("jdbc:duckdb:");
    }

    /**
     * Opens (creating if needed) a file-backed DuckDB instance, so that large tables spill
     * to disk instead of the heap.
     */
    static Connection openFile(Path databaseFile) throws SQLException {
        loadDriver();
        return DriverManager.getConnection("jdbc:duckdb:" + databaseFile.toAbsolutePath());
    }

    /**
     * Renders a path as a single-quoted SQL string literal.
     * DuckDB table functions do not take bind parameters for file names.
     */
    static String pathLiteral(Path path) {
        String normalized = path.toAbsolutePath().toString().replace("\\", "/");
        return "'" + normalized.replace("'", "''") + "'";
    }

    /**
     * Builds a {@code read_parquet} call for a single file.
     * Hive partition detection is disabled because partition files carry their own
     * {@code year}/{@code month} columns.
     */
    static String readParquet(Path path) {
        return "read_parquet(" + pathLiteral(path) + ", hive_partitioning = false)";
    }
}
