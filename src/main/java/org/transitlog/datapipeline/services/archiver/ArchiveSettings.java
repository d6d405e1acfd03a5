package org.transitlog.datapipeline.services.archiver;

import java.nio.file.Path;

import org.transitlog.datapipeline.resources.archive.ParquetPartitionFormat;

import com.typesafe.config.Config;

/**
 * Validated archive options from the {@code pipeline.archive} config block.
 *
 * @param directory        archive root
 * @param fileName         partition file name inside each month directory
 * @param rowGroupSize     rows per row group
 * @param compression      Parquet codec
 * @param queryWindowStart store scan start policy
 */
public record ArchiveSettings(
    Path directory,
    String fileName,
    int rowGroupSize,
    String compression,
    QueryWindowStart queryWindowStart
) {

    public static final int DEFAULT_ROW_GROUP_SIZE = 1_000_000;

    public ArchiveSettings {
        if (rowGroupSize <= 0) {
            throw new IllegalArgumentException("archive.rowGroupSize must be positive, got " + rowGroupSize);
        }
        if (fileName == null || fileName.isBlank() || fileName.contains("/")) {
            throw new IllegalArgumentException("archive.fileName must be a plain file name, got '" + fileName + "'");
        }
        if (!ParquetPartitionFormat.SUPPORTED_CODECS.contains(compression)) {
            throw new IllegalArgumentException("archive.compression must be one of "
                + ParquetPartitionFormat.SUPPORTED_CODECS + ", got '" + compression + "'");
        }
    }

    /**
     * Reads the settings from an archive config block.
     *
     * @param archiveConfig the {@code pipeline.archive} block
     * @return validated settings
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ArchiveSettings fromConfig(Config archiveConfig) {
        String window = archiveConfig.hasPath("queryWindowStart")
            ? archiveConfig.getString("queryWindowStart")
            : QueryWindowStart.WATERMARK.name();
        QueryWindowStart windowStart;
        try {
            windowStart = QueryWindowStart.valueOf(window.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("archive.queryWindowStart must be WATERMARK or PERIOD_START, got '"
                + window + "'", e);
        }
        return new ArchiveSettings(
            Path.of(archiveConfig.getString("directory")),
            archiveConfig.hasPath("fileName") ? archiveConfig.getString("fileName") : "vehicle_positions.parquet",
            archiveConfig.hasPath("rowGroupSize") ? archiveConfig.getInt("rowGroupSize") : DEFAULT_ROW_GROUP_SIZE,
            archiveConfig.hasPath("compression") ? archiveConfig.getString("compression").toUpperCase() : "ZSTD",
            windowStart
        );
    }

    /**
     * Returns a copy pointing at another archive root.
     *
     * @param newDirectory the archive root to use
     * @return settings with {@code directory} replaced
     */
    public ArchiveSettings withDirectory(Path newDirectory) {
        return new ArchiveSettings(newDirectory, fileName, rowGroupSize, compression, queryWindowStart);
    }
}
