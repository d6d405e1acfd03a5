package org.transitlog.datapipeline.resources.database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.database.IVehiclePositionStore;
import org.transitlog.datapipeline.api.resources.database.dto.TimestampBounds;
import org.transitlog.datapipeline.api.resources.storage.CheckedConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * H2 implementation of the transactional vehicle position store using HikariCP for
 * connection pooling.
 * <p>
 * H2 has no use for the feed's timestamp semantics beyond ordering, so {@code start_time}
 * and {@code timestamp} are kept as epoch seconds in {@code BIGINT} columns and converted
 * to {@link Instant} at this boundary.
 * <p>
 * Configuration:
 * <pre>
 * database {
 *   jdbcUrl = "jdbc:h2:/srv/gtfs/realtime;IFEXISTS=TRUE"
 *   username = "sa"
 *   password = ""
 *   maxPoolSize = 2
 *   fetchSize = 10000
 * }
 * </pre>
 */
public class H2VehiclePositionStore implements IVehiclePositionStore {

    private static final Logger log = LoggerFactory.getLogger(H2VehiclePositionStore.class);

    static final String TABLE_NAME = "vehicle_positions";

    private static final String COLUMNS =
        "trip_id, route_id, direction_id, start_time, schedule_relationship, "
        + "latitude, longitude, bearing, odometer, speed, current_stop_sequence, stop_id, "
        + "current_status, \"timestamp\", congestion_level, occupancy_status, "
        + "vehicle_id, vehicle_label, license_plate";

    private static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS " + TABLE_NAME + " ("
        + "trip_id VARCHAR, "
        + "route_id VARCHAR, "
        + "direction_id SMALLINT, "
        + "start_time BIGINT, "
        + "schedule_relationship SMALLINT, "
        + "latitude DOUBLE PRECISION, "
        + "longitude DOUBLE PRECISION, "
        + "bearing DOUBLE PRECISION, "
        + "odometer DOUBLE PRECISION, "
        + "speed DOUBLE PRECISION, "
        + "current_stop_sequence BIGINT, "
        + "stop_id VARCHAR, "
        + "current_status SMALLINT, "
        + "\"timestamp\" BIGINT, "
        + "congestion_level SMALLINT, "
        + "occupancy_status SMALLINT, "
        + "vehicle_id VARCHAR, "
        + "vehicle_label VARCHAR, "
        + "license_plate VARCHAR, "
        + "CONSTRAINT uq_vehicle_positions_trip_ts UNIQUE (trip_id, \"timestamp\"))";

    private static final String CREATE_INDEX_SQL =
        "CREATE INDEX IF NOT EXISTS idx_vehicle_positions_ts ON " + TABLE_NAME + " (\"timestamp\")";

    private static final String INSERT_SQL =
        "INSERT INTO " + TABLE_NAME + " (" + COLUMNS + ") "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String EXISTS_SQL =
        "SELECT COUNT(*) FROM " + TABLE_NAME + " WHERE trip_id = ? AND \"timestamp\" = ?";

    // timestamp > 0 skips rows the feed delivered without a timestamp
    private static final String BOUNDS_SQL =
        "SELECT MIN(\"timestamp\"), MAX(\"timestamp\") FROM " + TABLE_NAME + " WHERE \"timestamp\" > 0";

    private static final String SCAN_SQL =
        "SELECT " + COLUMNS + " FROM " + TABLE_NAME
        + " WHERE \"timestamp\" >= ? AND \"timestamp\" < ? ORDER BY \"timestamp\"";

    private final String name;
    private final HikariDataSource dataSource;
    private final int fetchSize;

    /**
     * Creates the store and starts its connection pool.
     *
     * @param name    resource name, used as pool name in log output
     * @param options database configuration (see class documentation)
     */
    public H2VehiclePositionStore(String name, Config options) {
        this.name = name;
        this.fetchSize = options.hasPath("fetchSize") ? options.getInt("fetchSize") : 10_000;

        final String jdbcUrl = options.getString("jdbcUrl");
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 2);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 1);
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                    "Cannot open store '%s': database file already in use by another process (%s)",
                    name, jdbcUrl);
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to open store '%s' at %s: %s",
                name, jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }
        log.debug("Store '{}' connection pool started (url={}, max={})",
            name, jdbcUrl, hikariConfig.getMaximumPoolSize());
    }

    @Override
    public void createSchemaIfNotExists() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
        }
    }

    @Override
    public int append(List<VehiclePosition> positions) throws SQLException {
        if (positions.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement exists = conn.prepareStatement(EXISTS_SQL);
                 PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                int stored = 0;
                for (VehiclePosition position : positions) {
                    if (position.tripId() != null && isStored(exists, position)) {
                        continue;
                    }
                    bindPosition(insert, position);
                    stored += insert.executeUpdate();
                }
                conn.commit();
                log.debug("Stored {} of {} vehicle positions", stored, positions.size());
                return stored;
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            }
        }
    }

    private boolean isStored(PreparedStatement exists, VehiclePosition position) throws SQLException {
        exists.setString(1, position.tripId());
        exists.setLong(2, position.timestamp().getEpochSecond());
        try (ResultSet rs = exists.executeQuery()) {
            return rs.next() && rs.getLong(1) > 0;
        }
    }

    @Override
    public Optional<TimestampBounds> findTimestampBounds() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(BOUNDS_SQL)) {
            if (!rs.next()) {
                return Optional.empty();
            }
            long min = rs.getLong(1);
            if (rs.wasNull()) {
                return Optional.empty();
            }
            long max = rs.getLong(2);
            return Optional.of(new TimestampBounds(Instant.ofEpochSecond(min), Instant.ofEpochSecond(max)));
        }
    }

    @Override
    public long scanPositions(Instant from, Instant to, CheckedConsumer<VehiclePosition> consumer)
            throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            conn.setReadOnly(true);
            try (PreparedStatement stmt = conn.prepareStatement(SCAN_SQL)) {
                stmt.setFetchSize(fetchSize);
                stmt.setLong(1, from.getEpochSecond());
                stmt.setLong(2, to.getEpochSecond());
                long count = 0;
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        consumer.accept(readPosition(rs));
                        count++;
                    }
                }
                return count;
            } finally {
                conn.setReadOnly(false);
            }
        }
    }

    private static void bindPosition(PreparedStatement ps, VehiclePosition p) throws SQLException {
        setNullableString(ps, 1, p.tripId());
        setNullableString(ps, 2, p.routeId());
        ps.setInt(3, p.directionId());
        ps.setLong(4, p.startTime().getEpochSecond());
        ps.setInt(5, p.scheduleRelationship());
        ps.setDouble(6, p.latitude());
        ps.setDouble(7, p.longitude());
        ps.setDouble(8, p.bearing());
        ps.setDouble(9, p.odometer());
        ps.setDouble(10, p.speed());
        ps.setLong(11, p.currentStopSequence());
        setNullableString(ps, 12, p.stopId());
        ps.setInt(13, p.currentStatus());
        ps.setLong(14, p.timestamp().getEpochSecond());
        ps.setInt(15, p.congestionLevel());
        ps.setInt(16, p.occupancyStatus());
        setNullableString(ps, 17, p.vehicleId());
        setNullableString(ps, 18, p.vehicleLabel());
        setNullableString(ps, 19, p.licensePlate());
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    /**
     * Converts one store row into the canonical record shape.
     * Column order follows {@link #COLUMNS}.
     */
    private static VehiclePosition readPosition(ResultSet rs) throws SQLException {
        return new VehiclePosition(
            rs.getString(1),
            rs.getString(2),
            rs.getInt(3),
            Instant.ofEpochSecond(rs.getLong(4)),
            rs.getInt(5),
            rs.getDouble(6),
            rs.getDouble(7),
            rs.getDouble(8),
            rs.getDouble(9),
            rs.getDouble(10),
            rs.getLong(11),
            rs.getString(12),
            rs.getInt(13),
            Instant.ofEpochSecond(rs.getLong(14)),
            rs.getInt(15),
            rs.getInt(16),
            rs.getString(17),
            rs.getString(18),
            rs.getString(19)
        );
    }

    /**
     * Closes the connection pool.
     * <p>
     * A SQL {@code SHUTDOWN} is issued first so that H2 flushes the MVStore to disk; closing
     * the Hikari pool alone only returns connections.
     */
    @Override
    public void close() {
        if (dataSource == null || dataSource.isClosed()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        } catch (SQLException e) {
            // 90121 = database already closed, expected for in-memory databases
            if (e.getErrorCode() != 90121) {
                log.warn("Store '{}' shutdown command failed: {}", name, e.getMessage());
            }
        }
        dataSource.close();
        log.debug("Store '{}' connection pool closed", name);
    }
}
