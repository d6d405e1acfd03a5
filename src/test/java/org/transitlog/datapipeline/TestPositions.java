package org.transitlog.datapipeline;

import java.time.Instant;
import java.util.UUID;

import org.transitlog.datapipeline.api.contracts.VehiclePosition;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Shared fixtures for archive tests.
 */
public final class TestPositions {

    public static final Instant T1 = Instant.parse("2024-01-15T10:00:00Z");
    public static final Instant T2 = Instant.parse("2024-02-10T08:00:00Z");
    public static final Instant T3 = Instant.parse("2024-02-10T08:00:30Z");

    private TestPositions() {
    }

    /**
     * Creates a fully populated position.
     *
     * @param vehicleId vehicle id, may be {@code null}
     * @param tripId    trip id
     * @param timestamp observation time
     * @return the position
     */
    public static VehiclePosition position(String vehicleId, String tripId, Instant timestamp) {
        return new VehiclePosition(
            tripId,
            "route-7",
            1,
            Instant.parse("2024-01-01T06:30:00Z"),
            0,
            60.1699,
            24.9384,
            270.0,
            1234.5,
            11.2,
            4_000_000_000L,
            "stop-42",
            2,
            timestamp,
            1,
            3,
            vehicleId,
            "Bus " + vehicleId,
            "ABC-123"
        );
    }

    /**
     * Returns the config block of a private in-memory H2 store.
     *
     * @return database config
     */
    public static Config inMemoryStoreConfig() {
        return ConfigFactory.parseString(
            "jdbcUrl = \"jdbc:h2:mem:store-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1\"\n"
            + "maxPoolSize = 2\n"
            + "minIdle = 0\n");
    }
}
