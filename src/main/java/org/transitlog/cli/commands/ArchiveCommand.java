package org.transitlog.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.transitlog.cli.CommandLineInterface;
import org.transitlog.datapipeline.api.archive.ArchiveIntegrityException;
import org.transitlog.datapipeline.resources.database.H2VehiclePositionStore;
import org.transitlog.datapipeline.services.archiver.ArchiveDriver;
import org.transitlog.datapipeline.services.archiver.ArchiveSettings;
import org.transitlog.datapipeline.services.archiver.ArchiveSummary;
import org.transitlog.datapipeline.services.archiver.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that merges the vehicle positions of the store into monthly Parquet partitions.
 * <p>
 * Both locations default to the configured data directory. The store is opened the same
 * way either way: it must exist. The run stops at the first failing month.
 */
@Command(
    name = "archive",
    description = "Archive stored vehicle positions into monthly Parquet partitions"
)
public class ArchiveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ArchiveCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INTEGRITY_VIOLATION = 2;

    private static final String H2_FILE_SUFFIX = ".mv.db";

    @Option(
        names = {"--db"},
        description = "H2 store file (default: pipeline.database.file, i.e. <dataBaseDir>/realtime)"
    )
    private Path storeFile;

    @Option(
        names = {"--archive-dir"},
        description = "Archive root directory (default: pipeline.archive.directory, i.e. <dataBaseDir>/archive)"
    )
    private Path archiveDir;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config pipeline = parent.getConfig().getConfig("pipeline");
            ArchiveSettings settings = ArchiveSettings.fromConfig(pipeline.getConfig("archive"));
            if (archiveDir != null) {
                settings = settings.withDirectory(archiveDir);
            }

            Config dbConfig = pipeline.getConfig("database");
            Path file = storeFile != null ? storeFile : Path.of(dbConfig.getString("file"));
            dbConfig = dbConfig.withValue("jdbcUrl", ConfigValueFactory.fromAnyRef(toJdbcUrl(file)));

            ArchiveSummary summary;
            try (H2VehiclePositionStore store = new H2VehiclePositionStore("vehicle-store", dbConfig)) {
                summary = ArchiveDriver.create(settings).run(store, settings.directory());
            }
            printSummary(out, summary);
            return EXIT_OK;

        } catch (ArchiveIntegrityException e) {
            log.error("Archive aborted, partition output cannot be trusted: {}", e.getMessage());
            err.println("Fatal: " + e.getMessage());
            return EXIT_INTEGRITY_VIOLATION;
        } catch (Exception e) {
            log.error("Archive failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    /**
     * Builds the JDBC URL of an existing H2 store file.
     * <p>
     * Accepts the file with or without its {@code .mv.db} suffix. {@code IFEXISTS=TRUE}
     * keeps H2 from silently creating an empty store for a mistyped path.
     *
     * @param file the store file
     * @return JDBC URL for the store
     * @throws IllegalArgumentException if the store file does not exist
     */
    static String toJdbcUrl(Path file) {
        String absolute = file.toAbsolutePath().normalize().toString().replace("\\", "/");
        String base = absolute.endsWith(H2_FILE_SUFFIX)
            ? absolute.substring(0, absolute.length() - H2_FILE_SUFFIX.length())
            : absolute;
        if (!Files.isRegularFile(Path.of(base + H2_FILE_SUFFIX))) {
            throw new IllegalArgumentException("Store not found: " + base + H2_FILE_SUFFIX);
        }
        return "jdbc:h2:" + base + ";IFEXISTS=TRUE";
    }

    private static void printSummary(PrintWriter out, ArchiveSummary summary) {
        if (summary.range().isEmpty()) {
            out.println("No vehicle positions to archive.");
            return;
        }
        out.printf("%n=== Archive Summary (%s) ===%n", summary.range().get());
        for (MergeResult result : summary.partitions()) {
            out.printf("  %s  %,d copied, %,d new, %,d skipped, %,d total%n",
                result.partition(), result.copiedRows(), result.newRows(), result.skippedRows(),
                result.totalRows());
        }
        out.printf("Partitions: %d, new rows: %,d%n", summary.partitions().size(), summary.newRows());
    }
}
