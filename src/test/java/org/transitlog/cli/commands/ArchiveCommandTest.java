package org.transitlog.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.transitlog.datapipeline.TestPositions.T1;
import static org.transitlog.datapipeline.TestPositions.T2;
import static org.transitlog.datapipeline.TestPositions.position;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.transitlog.cli.CommandLineInterface;
import org.transitlog.datapipeline.resources.database.H2VehiclePositionStore;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;

/**
 * Tests for the archive command: parsing, exit codes and an end-to-end run against an H2 file.
 */
public class ArchiveCommandTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("pipeline.dataBaseDir");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @Tag("unit")
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKey("archive");
    }

    @Test
    @Tag("unit")
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        cmdLine.execute("archive", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("archive");
        assertThat(output).contains("--db");
        assertThat(output).contains("--archive-dir");
    }

    @Test
    @Tag("unit")
    void testToJdbcUrlAcceptsFileWithOrWithoutSuffix() throws Exception {
        Path base = tempDir.resolve("realtime");
        Files.writeString(tempDir.resolve("realtime.mv.db"), "");

        String expected = "jdbc:h2:" + base.toAbsolutePath().normalize().toString().replace("\\", "/")
            + ";IFEXISTS=TRUE";
        assertThat(ArchiveCommand.toJdbcUrl(base)).isEqualTo(expected);
        assertThat(ArchiveCommand.toJdbcUrl(tempDir.resolve("realtime.mv.db"))).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void testToJdbcUrlRejectsMissingStore() {
        assertThatThrownBy(() -> ArchiveCommand.toJdbcUrl(tempDir.resolve("missing")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Store not found");
    }

    @Test
    @Tag("integration")
    void testMissingStoreFails() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("archive",
            "--db", tempDir.resolve("missing.mv.db").toString(),
            "--archive-dir", tempDir.resolve("archive").toString());

        assertThat(exitCode).isEqualTo(ArchiveCommand.EXIT_FAILED);
        assertThat(err.toString()).contains("Store not found");
        assertThat(tempDir.resolve("archive")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void testArchivesStoreFile() throws Exception {
        Path storeBase = tempDir.resolve("realtime");
        seedStore(storeBase);
        Path archiveDir = tempDir.resolve("archive");

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("archive",
            "--db", storeBase + ".mv.db",
            "--archive-dir", archiveDir.toString());

        assertThat(exitCode).as(err.toString()).isEqualTo(ArchiveCommand.EXIT_OK);
        assertThat(out.toString()).contains("=== Archive Summary (2024-01..2024-02) ===");
        assertThat(archiveDir.resolve("year=2024/month=01/vehicle_positions.parquet")).isRegularFile();
        assertThat(archiveDir.resolve("year=2024/month=02/vehicle_positions.parquet")).isRegularFile();
    }

    @Test
    @Tag("integration")
    void testDefaultsToStoreAndArchiveBelowDataBaseDir() throws Exception {
        seedStore(tempDir.resolve("realtime"));
        System.setProperty("pipeline.dataBaseDir", tempDir.toAbsolutePath().toString());
        ConfigFactory.invalidateCaches();

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("archive");

        assertThat(exitCode).as(err.toString()).isEqualTo(ArchiveCommand.EXIT_OK);
        assertThat(tempDir.resolve("archive/year=2024/month=01/vehicle_positions.parquet")).isRegularFile();
        assertThat(tempDir.resolve("archive/year=2024/month=02/vehicle_positions.parquet")).isRegularFile();
    }

    @Test
    @Tag("integration")
    void testMissingDefaultStoreIsNotCreated() {
        System.setProperty("pipeline.dataBaseDir", tempDir.toAbsolutePath().toString());
        ConfigFactory.invalidateCaches();

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("archive");

        assertThat(exitCode).isEqualTo(ArchiveCommand.EXIT_FAILED);
        assertThat(err.toString()).contains("Store not found");
        assertThat(tempDir.resolve("realtime.mv.db")).doesNotExist();
        assertThat(tempDir.resolve("archive")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void testEmptyStoreReportsNothingToArchive() throws Exception {
        Path storeBase = tempDir.resolve("empty");
        try (H2VehiclePositionStore store = new H2VehiclePositionStore("cli-test", storeConfig(storeBase))) {
            store.createSchemaIfNotExists();
        }

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("archive",
            "--db", storeBase.toString(),
            "--archive-dir", tempDir.resolve("archive").toString());

        assertThat(exitCode).isEqualTo(ArchiveCommand.EXIT_OK);
        assertThat(out.toString()).contains("No vehicle positions to archive.");
    }

    private static void seedStore(Path storeBase) throws Exception {
        try (H2VehiclePositionStore store = new H2VehiclePositionStore("cli-test", storeConfig(storeBase))) {
            store.createSchemaIfNotExists();
            store.append(List.of(position("V1", "trip-1", T1), position("V1", "trip-2", T2)));
        }
    }

    private static Config storeConfig(Path storeBase) {
        return ConfigFactory.parseString(
            "jdbcUrl = \"jdbc:h2:" + storeBase.toAbsolutePath().toString().replace("\\", "/") + "\"");
    }
}
