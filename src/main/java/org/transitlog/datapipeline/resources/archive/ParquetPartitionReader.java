package org.transitlog.datapipeline.resources.archive;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.archive.IPartitionReader;
import org.transitlog.datapipeline.api.resources.storage.CheckedConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a Parquet partition file through an in-memory DuckDB instance.
 * <p>
 * Each scan is a fresh {@code read_parquet} query, so scans are repeatable and always
 * start at the first row. DuckDB streams the file row group by row group; the heap only
 * holds the JDBC fetch window.
 */
public class ParquetPartitionReader implements IPartitionReader {

    private static final Logger log = LoggerFactory.getLogger(ParquetPartitionReader.class);

    private final Path path;
    private final Connection connection;
    private long rowCount = -1;

    ParquetPartitionReader(Path path) throws IOException {
        this.path = path;
        try {
            this.connection = DuckDbSupport.openInMemory();
        } catch (SQLException e) {
            throw new IOException("Failed to open DuckDB for reading " + path, e);
        }
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public long getRowCount() throws PartitionCodecException {
        if (rowCount >= 0) {
            return rowCount;
        }
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + DuckDbSupport.readParquet(path))) {
            rs.next();
            rowCount = rs.getLong(1);
            return rowCount;
        } catch (SQLException e) {
            throw new PartitionCodecException("Failed to read row count of " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long forEachRow(CheckedConsumer<VehiclePosition> consumer) throws IOException, PartitionCodecException {
        String sql = "SELECT " + ParquetColumns.DECODE_COLUMNS + " FROM " + DuckDbSupport.readParquet(path);
        long count = 0;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                VehiclePosition position = decode(rs);
                try {
                    consumer.accept(position);
                } catch (IOException | PartitionCodecException | RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IOException("Row consumer failed while reading " + path, e);
                }
                count++;
            }
        } catch (SQLException e) {
            throw new PartitionCodecException("Failed to decode rows of " + path + ": " + e.getMessage(), e);
        }
        log.debug("Read {} rows from {}", count, path);
        return count;
    }

    private static VehiclePosition decode(ResultSet rs) throws SQLException {
        return new VehiclePosition(
            rs.getString(1),
            rs.getString(2),
            rs.getInt(3),
            Instant.ofEpochMilli(rs.getLong(4)),
            rs.getInt(5),
            rs.getDouble(6),
            rs.getDouble(7),
            rs.getDouble(8),
            rs.getDouble(9),
            rs.getDouble(10),
            rs.getLong(11),
            rs.getString(12),
            rs.getInt(13),
            Instant.ofEpochMilli(rs.getLong(14)),
            rs.getInt(15),
            rs.getInt(16),
            rs.getString(17),
            rs.getString(18),
            rs.getString(19)
        );
    }

    @Override
    public void close() throws IOException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Failed to close DuckDB reader for " + path, e);
        }
    }
}
