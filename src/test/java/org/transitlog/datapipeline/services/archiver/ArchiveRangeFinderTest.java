package org.transitlog.datapipeline.services.archiver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.transitlog.datapipeline.api.archive.ArchiveRangeException;
import org.transitlog.datapipeline.api.contracts.PartitionKey;
import org.transitlog.datapipeline.api.resources.database.IVehiclePositionStore;
import org.transitlog.datapipeline.api.resources.database.dto.TimestampBounds;

@Tag("unit")
class ArchiveRangeFinderTest {

    private final IVehiclePositionStore store = mock(IVehiclePositionStore.class);
    private final ArchiveRangeFinder finder = new ArchiveRangeFinder();

    @Test
    void emptyStore_yieldsNoRange() throws Exception {
        when(store.findTimestampBounds()).thenReturn(Optional.empty());

        assertThat(finder.computeRange(store)).isEmpty();
    }

    @Test
    void boundsSpanningMonths_yieldInclusiveRange() throws Exception {
        when(store.findTimestampBounds()).thenReturn(Optional.of(new TimestampBounds(
            Instant.parse("2023-11-30T23:59:59Z"), Instant.parse("2024-02-01T00:00:00Z"))));

        MonthRange range = finder.computeRange(store).orElseThrow();

        assertThat(range.first()).isEqualTo(new PartitionKey(2023, 11));
        assertThat(range.last()).isEqualTo(new PartitionKey(2024, 2));
        assertThat(range.months()).containsExactly(
            new PartitionKey(2023, 11), new PartitionKey(2023, 12),
            new PartitionKey(2024, 1), new PartitionKey(2024, 2));
    }

    @Test
    void singleRow_yieldsSingleMonth() throws Exception {
        Instant t = Instant.parse("2024-02-10T08:00:00Z");
        when(store.findTimestampBounds()).thenReturn(Optional.of(new TimestampBounds(t, t)));

        assertThat(finder.computeRange(store).orElseThrow().months())
            .containsExactly(new PartitionKey(2024, 2));
    }

    @Test
    void queryFailure_isWrapped() throws Exception {
        when(store.findTimestampBounds()).thenThrow(new SQLException("table missing"));

        assertThatThrownBy(() -> finder.computeRange(store))
            .isInstanceOf(ArchiveRangeException.class)
            .hasMessageContaining("table missing")
            .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void nonPositiveEarliest_isRejected() throws Exception {
        when(store.findTimestampBounds()).thenReturn(Optional.of(new TimestampBounds(
            Instant.EPOCH, Instant.parse("2024-02-10T08:00:00Z"))));

        assertThatThrownBy(() -> finder.computeRange(store))
            .isInstanceOf(ArchiveRangeException.class);
    }
}
