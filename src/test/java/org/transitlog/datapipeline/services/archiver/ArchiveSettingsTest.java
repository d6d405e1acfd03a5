package org.transitlog.datapipeline.services.archiver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class ArchiveSettingsTest {

    @Test
    void fromConfig_readsAllValues() {
        ArchiveSettings settings = ArchiveSettings.fromConfig(ConfigFactory.parseString(
            "directory = \"/srv/archive\"\n"
            + "fileName = \"positions.parquet\"\n"
            + "rowGroupSize = 250\n"
            + "compression = \"snappy\"\n"
            + "queryWindowStart = \"period_start\"\n"));

        assertThat(settings.directory()).isEqualTo(Path.of("/srv/archive"));
        assertThat(settings.fileName()).isEqualTo("positions.parquet");
        assertThat(settings.rowGroupSize()).isEqualTo(250);
        assertThat(settings.compression()).isEqualTo("SNAPPY");
        assertThat(settings.queryWindowStart()).isEqualTo(QueryWindowStart.PERIOD_START);
    }

    @Test
    void fromConfig_appliesDefaults() {
        ArchiveSettings settings = ArchiveSettings.fromConfig(ConfigFactory.parseString("directory = \"a\""));

        assertThat(settings.fileName()).isEqualTo("vehicle_positions.parquet");
        assertThat(settings.rowGroupSize()).isEqualTo(ArchiveSettings.DEFAULT_ROW_GROUP_SIZE);
        assertThat(settings.compression()).isEqualTo("ZSTD");
        assertThat(settings.queryWindowStart()).isEqualTo(QueryWindowStart.WATERMARK);
    }

    @Test
    void referenceConfig_isValid() {
        ArchiveSettings settings = ArchiveSettings.fromConfig(
            ConfigFactory.defaultReference().getConfig("pipeline.archive"));

        assertThat(settings.directory()).isEqualTo(Path.of("data/archive"));
        assertThat(settings.rowGroupSize()).isEqualTo(1_000_000);
    }

    @Test
    void fromConfig_rejectsUnknownWindowStart() {
        assertThatThrownBy(() -> ArchiveSettings.fromConfig(ConfigFactory.parseString(
            "directory = \"a\"\nqueryWindowStart = \"yesterday\"")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queryWindowStart");
    }

    @Test
    void fromConfig_rejectsUnsupportedCompression() {
        assertThatThrownBy(() -> ArchiveSettings.fromConfig(ConfigFactory.parseString(
            "directory = \"a\"\ncompression = \"brotli\"")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("archive.compression");
    }

    @Test
    void rejectsNonPositiveRowGroupSize() {
        assertThatThrownBy(() -> new ArchiveSettings(Path.of("a"), "f.parquet", 0, "ZSTD",
            QueryWindowStart.WATERMARK))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withDirectory_replacesOnlyDirectory() {
        ArchiveSettings settings = new ArchiveSettings(Path.of("a"), "f.parquet", 10, "ZSTD",
            QueryWindowStart.WATERMARK);

        assertThat(settings.withDirectory(Path.of("b")))
            .isEqualTo(new ArchiveSettings(Path.of("b"), "f.parquet", 10, "ZSTD", QueryWindowStart.WATERMARK));
    }
}
