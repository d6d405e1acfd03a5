package org.transitlog.datapipeline.resources.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.transitlog.datapipeline.TestPositions.T2;
import static org.transitlog.datapipeline.TestPositions.T3;
import static org.transitlog.datapipeline.TestPositions.position;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.transitlog.datapipeline.api.archive.PartitionCodecException;
import org.transitlog.datapipeline.api.contracts.VehiclePosition;
import org.transitlog.datapipeline.api.resources.archive.IPartitionReader;
import org.transitlog.datapipeline.api.resources.archive.IPartitionWriter;

/**
 * Integration tests for the DuckDB backed Parquet reader and writer.
 */
@Tag("integration")
class ParquetPartitionFormatTest {

    @TempDir
    Path tempDir;

    private final ParquetPartitionFormat format =
        new ParquetPartitionFormat("vehicle_positions.parquet", "ZSTD", 2);

    @Test
    void writtenRowsReadBackUnchanged() throws Exception {
        Path file = tempDir.resolve("vehicle_positions.parquet");
        List<VehiclePosition> rows = List.of(
            position("v1", "trip-1", T2),
            position("v2", "trip-2", T2),
            position(null, "trip-3", T3));

        try (IPartitionWriter writer = format.create(file)) {
            assertThat(writer.write(rows)).isEqualTo(3);
            assertThat(writer.finish()).isEqualTo(3);
        }

        try (IPartitionReader reader = format.openExisting(file).orElseThrow()) {
            assertThat(reader.getRowCount()).isEqualTo(3);
            assertThat(readAll(reader)).containsExactlyElementsOf(rows);
        }
    }

    @Test
    void forEachRow_isRepeatable() throws Exception {
        Path file = writeFile("a.parquet", List.of(position("v1", "trip-1", T2)));

        try (IPartitionReader reader = format.openExisting(file).orElseThrow()) {
            assertThat(readAll(reader)).hasSize(1);
            assertThat(readAll(reader)).hasSize(1);
        }
    }

    @Test
    void copyFrom_keepsExistingRowsAheadOfNewRows() throws Exception {
        Path existing = writeFile("existing.parquet", List.of(position("v1", "trip-1", T2)));
        Path staging = tempDir.resolve("existing.parquet.tmp");

        try (IPartitionReader reader = format.openExisting(existing).orElseThrow();
             IPartitionWriter writer = format.create(staging)) {
            assertThat(writer.copyFrom(reader)).isEqualTo(1);
            writer.write(List.of(position("v1", "trip-1", T3)));
            assertThat(writer.finish()).isEqualTo(2);
        }

        try (IPartitionReader reader = format.openExisting(staging).orElseThrow()) {
            assertThat(readAll(reader)).extracting(VehiclePosition::timestamp).containsExactly(T2, T3);
        }
    }

    @Test
    void fileCarriesPartitionColumnsAndCompression() throws Exception {
        Path file = writeFile("cols.parquet", List.of(position("v1", "trip-1", T2)));

        try (Connection conn = DuckDbSupport.openInMemory();
             Statement stmt = conn.createStatement()) {
            try (ResultSet rs = stmt.executeQuery(
                    "SELECT \"year\", \"month\" FROM " + DuckDbSupport.readParquet(file))) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getInt(1)).isEqualTo(2024);
                assertThat(rs.getInt(2)).isEqualTo(2);
            }
            try (ResultSet rs = stmt.executeQuery(
                    "SELECT DISTINCT compression FROM parquet_metadata(" + DuckDbSupport.pathLiteral(file) + ")")) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getString(1)).isEqualToIgnoringCase("ZSTD");
            }
        }
    }

    @Test
    void emptyPartitionIsReadable() throws Exception {
        Path file = writeFile("empty.parquet", List.of());

        try (IPartitionReader reader = format.openExisting(file).orElseThrow()) {
            assertThat(reader.getRowCount()).isZero();
            assertThat(readAll(reader)).isEmpty();
        }
    }

    @Test
    void close_removesWorkDatabase() throws Exception {
        Path staging = tempDir.resolve("work.parquet.tmp");

        try (IPartitionWriter writer = format.create(staging)) {
            writer.write(List.of(position("v1", "trip-1", T2)));
            assertThat(ParquetPartitionFormat.workDatabaseFor(staging)).exists();
        }

        for (Path workFile : format.workFiles(staging)) {
            assertThat(workFile).doesNotExist();
        }
        assertThat(staging).doesNotExist();
    }

    @Test
    void openExisting_emptyForMissingFile() throws Exception {
        assertThat(format.openExisting(tempDir.resolve("missing.parquet"))).isEmpty();
    }

    @Test
    void openExisting_corruptFileFailsOnRead() throws Exception {
        Path file = tempDir.resolve("corrupt.parquet");
        Files.writeString(file, "not parquet");

        try (IPartitionReader reader = format.openExisting(file).orElseThrow()) {
            assertThatThrownBy(reader::getRowCount)
                .isInstanceOf(PartitionCodecException.class);
        }
    }

    @Test
    void constructor_rejectsUnknownCodec() {
        assertThatThrownBy(() -> new ParquetPartitionFormat("x.parquet", "LZ4_RAW_TURBO", 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private Path writeFile(String name, List<VehiclePosition> rows) throws Exception {
        Path file = tempDir.resolve(name);
        try (IPartitionWriter writer = format.create(file)) {
            writer.write(rows);
            writer.finish();
        }
        return file;
    }

    private static List<VehiclePosition> readAll(IPartitionReader reader) throws Exception {
        List<VehiclePosition> rows = new ArrayList<>();
        reader.forEachRow(rows::add);
        return rows;
    }
}
