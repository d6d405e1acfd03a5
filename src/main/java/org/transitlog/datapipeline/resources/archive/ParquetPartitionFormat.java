package org.transitlog.datapipeline.resources.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.transitlog.datapipeline.api.resources.archive.IPartitionFormat;
import org.transitlog.datapipeline.api.resources.archive.IPartitionReader;
import org.transitlog.datapipeline.api.resources.archive.IPartitionWriter;

/**
 * Parquet partition files, read and written through DuckDB.
 */
public class ParquetPartitionFormat implements IPartitionFormat {

    /** Codecs accepted by DuckDB's Parquet writer that are useful for archives. */
    public static final Set<String> SUPPORTED_CODECS = Set.of("ZSTD", "SNAPPY", "GZIP", "UNCOMPRESSED");

    private static final String WORK_DATABASE_SUFFIX = ".work.duckdb";

    private final String fileName;
    private final String compression;
    private final int rowGroupSize;

    /**
     * @param fileName     partition file name, e.g. {@code vehicle_positions.parquet}
     * @param compression  one of {@link #SUPPORTED_CODECS}
     * @param rowGroupSize maximum rows per Parquet row group
     */
    public ParquetPartitionFormat(String fileName, String compression, int rowGroupSize) {
        if (!SUPPORTED_CODECS.contains(compression)) {
            throw new IllegalArgumentException("Unsupported Parquet compression '" + compression
                + "', expected one of " + SUPPORTED_CODECS);
        }
        if (rowGroupSize <= 0) {
            throw new IllegalArgumentException("rowGroupSize must be positive");
        }
        this.fileName = fileName;
        this.compression = compression;
        this.rowGroupSize = rowGroupSize;
    }

    @Override
    public String getFileName() {
        return fileName;
    }

    @Override
    public Optional<IPartitionReader> openExisting(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(new ParquetPartitionReader(path));
    }

    @Override
    public IPartitionWriter create(Path stagingPath) throws IOException {
        return new ParquetPartitionWriter(stagingPath, workDatabaseFor(stagingPath), compression, rowGroupSize);
    }

    @Override
    public List<Path> workFiles(Path stagingPath) {
        return workFilesFor(workDatabaseFor(stagingPath));
    }

    static Path workDatabaseFor(Path stagingPath) {
        return stagingPath.resolveSibling(stagingPath.getFileName() + WORK_DATABASE_SUFFIX);
    }

    static List<Path> workFilesFor(Path workDatabase) {
        return List.of(workDatabase, workDatabase.resolveSibling(workDatabase.getFileName() + ".wal"));
    }
}
