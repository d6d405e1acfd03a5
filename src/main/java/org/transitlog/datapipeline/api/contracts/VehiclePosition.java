package org.transitlog.datapipeline.api.contracts;

import java.time.Instant;

/**
 * One vehicle position observation from the GTFS-realtime vehicle feed.
 * <p>
 * The transactional store keeps {@code startTime} and {@code timestamp} as epoch seconds;
 * they are converted to {@link Instant} when a row leaves the store and are written to
 * the archive as timestamp values.
 * <p>
 * String fields may be {@code null} when the feed left them unset. Numeric codes default
 * to {@code 0} in that case, matching the feed's own defaults.
 *
 * @param tripId               GTFS trip id
 * @param routeId              GTFS route id
 * @param directionId          direction of travel (0 or 1)
 * @param startTime            scheduled trip start
 * @param scheduleRelationship trip schedule relationship code
 * @param latitude             WGS84 latitude
 * @param longitude            WGS84 longitude
 * @param bearing              bearing in degrees clockwise from north
 * @param odometer             odometer reading in meters
 * @param speed                momentary speed in meters per second
 * @param currentStopSequence  stop sequence index of the current stop (unsigned 32-bit)
 * @param stopId               id of the current stop
 * @param currentStatus        vehicle stop status code
 * @param timestamp            moment the position was measured
 * @param congestionLevel      congestion level code
 * @param occupancyStatus      occupancy status code
 * @param vehicleId            internal vehicle id, the watermark key
 * @param vehicleLabel         user-visible vehicle label
 * @param licensePlate         license plate
 */
public record VehiclePosition(
    String tripId,
    String routeId,
    int directionId,
    Instant startTime,
    int scheduleRelationship,
    double latitude,
    double longitude,
    double bearing,
    double odometer,
    double speed,
    long currentStopSequence,
    String stopId,
    int currentStatus,
    Instant timestamp,
    int congestionLevel,
    int occupancyStatus,
    String vehicleId,
    String vehicleLabel,
    String licensePlate
) {

    public VehiclePosition {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (startTime == null) {
            startTime = Instant.EPOCH;
        }
    }

    /**
     * Returns whether this observation may be archived.
     * <p>
     * The feed occasionally delivers entities without a timestamp, which the store keeps
     * as {@code 0}. Such rows (and any non-positive timestamp) never reach a partition.
     *
     * @return {@code true} if the timestamp is strictly after the epoch
     */
    public boolean hasValidTimestamp() {
        return timestamp.getEpochSecond() > 0;
    }

    /**
     * Returns whether this row carries a vehicle id usable as a watermark key.
     *
     * @return {@code true} if the vehicle id is neither null nor empty
     */
    public boolean hasVehicleId() {
        return vehicleId != null && !vehicleId.isEmpty();
    }

    /**
     * Returns the partition this observation belongs to.
     *
     * @return the month containing {@link #timestamp()}
     */
    public PartitionKey partition() {
        return PartitionKey.containing(timestamp);
    }
}
