package org.transitlog.datapipeline.resources.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;

import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.PartitionKey;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.archive.IPartitionReader;
import org.transitlog.datapipeline.api.resources.archive.IPartitionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a Parquet partition file through a file-backed DuckDB work database.
 * <p>
 * Flow: rows are appended to a work table (existing partition first, then new row groups),
 * and {@link #finish()} exports the table with {@code COPY ... (FORMAT PARQUET)}. The work
 * database lives next to the staging file and is deleted on {@link #close()}; keeping it on
 * disk bounds heap usage regardless of partition size.
 * <p>
 * DuckDB's Parquet writer dictionary-encodes low-cardinality strings (vehicle, route and
 * stop ids) and compresses every column chunk with the configured codec.
 */
public class ParquetPartitionWriter implements IPartitionWriter {

    private static final Logger log = LoggerFactory.getLogger(ParquetPartitionWriter.class);

    private final Path stagingPath;
    private final Path workDatabase;
    private final String compression;
    private final int rowGroupSize;
    private final Connection connection;
    private final PreparedStatement insert;
    private boolean finished = false;

    ParquetPartitionWriter(Path stagingPath, Path workDatabase, String compression, int rowGroupSize)
            throws IOException {
        this.stagingPath = stagingPath;
        this.workDatabase = workDatabase;
        this.compression = compression;
        this.rowGroupSize = rowGroupSize;
        Connection conn = null;
        try {
            conn = DuckDbSupport.openFile(workDatabase);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(ParquetColumns.CREATE_TABLE_SQL);
            }
            this.connection = conn;
            this.insert = conn.prepareStatement(ParquetColumns.INSERT_SQL);
        } catch (SQLException e) {
            closeQuietly(conn);
            deleteWorkFiles();
            throw new IOException("Failed to create DuckDB work database " + workDatabase, e);
        }
    }

    @Override
    public Path getPath() {
        return stagingPath;
    }

    @Override
    public long copyFrom(IPartitionReader reader) throws PartitionCodecException {
        String sql = "INSERT INTO " + ParquetColumns.TABLE_NAME + " (" + ParquetColumns.ALL_COLUMNS + ") "
            + "SELECT " + ParquetColumns.ALL_COLUMNS + " FROM " + DuckDbSupport.readParquet(reader.getPath());
        try (Statement stmt = connection.createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw new PartitionCodecException(
                "Failed to copy rows from " + reader.getPath() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int write(List<VehiclePosition> batch) throws PartitionCodecException {
        if (batch.isEmpty()) {
            return 0;
        }
        try {
            for (VehiclePosition position : batch) {
                bind(insert, position);
                insert.addBatch();
            }
            int written = 0;
            for (int count : insert.executeBatch()) {
                written += Math.max(count, 0);
            }
            return written;
        } catch (SQLException e) {
            throw new PartitionCodecException("Failed to encode row group for " + stagingPath + ": "
                + e.getMessage(), e);
        }
    }

    private static void bind(PreparedStatement ps, VehiclePosition p) throws SQLException {
        PartitionKey partition = p.partition();
        setNullableString(ps, 1, p.tripId());
        setNullableString(ps, 2, p.routeId());
        ps.setInt(3, p.directionId());
        ps.setLong(4, p.startTime().toEpochMilli());
        ps.setInt(5, p.scheduleRelationship());
        ps.setDouble(6, p.latitude());
        ps.setDouble(7, p.longitude());
        ps.setDouble(8, p.bearing());
        ps.setDouble(9, p.odometer());
        ps.setDouble(10, p.speed());
        ps.setLong(11, p.currentStopSequence());
        setNullableString(ps, 12, p.stopId());
        ps.setInt(13, p.currentStatus());
        ps.setLong(14, p.timestamp().toEpochMilli());
        ps.setInt(15, p.congestionLevel());
        ps.setInt(16, p.occupancyStatus());
        setNullableString(ps, 17, p.vehicleId());
        setNullableString(ps, 18, p.vehicleLabel());
        setNullableString(ps, 19, p.licensePlate());
        ps.setInt(20, partition.year());
        ps.setInt(21, partition.month());
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    @Override
    public long finish() throws IOException, PartitionCodecException {
        if (finished) {
            throw new IllegalStateException("Writer for " + stagingPath + " already finished");
        }
        Files.deleteIfExists(stagingPath);
        String exportSql = String.format(
            "COPY %s TO %s (FORMAT PARQUET, CODEC '%s', ROW_GROUP_SIZE %d)",
            ParquetColumns.TABLE_NAME, DuckDbSupport.pathLiteral(stagingPath), compression, rowGroupSize);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(exportSql);
            long rows;
            try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + ParquetColumns.TABLE_NAME)) {
                rs.next();
                rows = rs.getLong(1);
            }
            finished = true;
            log.debug("Exported {} rows to {} ({}, row groups of {})", rows, stagingPath, compression, rowGroupSize);
            return rows;
        } catch (SQLException e) {
            throw new PartitionCodecException("Failed to export " + stagingPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            insert.close();
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Failed to close DuckDB work database " + workDatabase, e);
        } finally {
            deleteWorkFiles();
        }
    }

    private void deleteWorkFiles() throws IOException {
        for (Path file : ParquetPartitionFormat.workFilesFor(workDatabase)) {
            Files.deleteIfExists(file);
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("Failed to close DuckDB connection after setup error: {}", e.getMessage());
        }
    }
}
