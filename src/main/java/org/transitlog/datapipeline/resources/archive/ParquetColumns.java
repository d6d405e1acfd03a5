package org.transitlog.datapipeline.resources.archive;

/**
 * Column layout of a vehicle position partition file.
 * <p>
 * Timestamps are stored as Parquet {@code TIMESTAMP} values (UTC, no zone). {@code year}
 * and {@code month} repeat the partition key so that a file stays self-describing when it
 * is read outside its Hive-style directory.
 */
final class ParquetColumns {

    static final String TABLE_NAME = "vehicle_positions";

    static final String CREATE_TABLE_SQL =
        "CREATE TABLE " + TABLE_NAME + " ("
        + "trip_id VARCHAR, "
        + "route_id VARCHAR, "
        + "direction_id SMALLINT, "
        + "start_time TIMESTAMP, "
        + "schedule_relationship SMALLINT, "
        + "latitude DOUBLE, "
        + "longitude DOUBLE, "
        + "bearing DOUBLE, "
        + "odometer DOUBLE, "
        + "speed DOUBLE, "
        + "current_stop_sequence BIGINT, "
        + "stop_id VARCHAR, "
        + "current_status SMALLINT, "
        + "\"timestamp\" TIMESTAMP, "
        + "congestion_level SMALLINT, "
        + "occupancy_status SMALLINT, "
        + "vehicle_id VARCHAR, "
        + "vehicle_label VARCHAR, "
        + "license_plate VARCHAR, "
        + "\"year\" SMALLINT, "
        + "\"month\" SMALLINT)";

    static final String ALL_COLUMNS =
        "trip_id, route_id, direction_id, start_time, schedule_relationship, "
        + "latitude, longitude, bearing, odometer, speed, current_stop_sequence, stop_id, "
        + "current_status, \"timestamp\", congestion_level, occupancy_status, "
        + "vehicle_id, vehicle_label, license_plate, \"year\", \"month\"";

    /** Projection used when decoding rows: timestamps come back as epoch milliseconds. */
    static final String DECODE_COLUMNS =
        "trip_id, route_id, direction_id, epoch_ms(start_time), schedule_relationship, "
        + "latitude, longitude, bearing, odometer, speed, current_stop_sequence, stop_id, "
        + "current_status, epoch_ms(\"timestamp\"), congestion_level, occupancy_status, "
        + "vehicle_id, vehicle_label, license_plate";

    static final String INSERT_SQL =
        "INSERT INTO " + TABLE_NAME + " (" + ALL_COLUMNS + ") VALUES ("
        + "?, ?, ?, epoch_ms(CAST(? AS BIGINT)), ?, ?, ?, ?, ?, ?, ?, ?, ?, "
        + "epoch_ms(CAST(? AS BIGINT)), ?, ?, ?, ?, ?, ?, ?)";

    private ParquetColumns() {
    }
}
