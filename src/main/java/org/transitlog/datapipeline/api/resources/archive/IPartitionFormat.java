package org.transitlog.datapipeline.api.resources.archive;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Factory for the columnar file format backing archive partitions.
 */
public interface IPartitionFormat {

    /**
     * @return file name of a partition inside its month directory
     */
    String getFileName();

    /**
     * Opens an existing partition file.
     *
     * @param path partition file path
     * @return a reader, or empty if no file exists at {@code path}
     * @throws IOException if the file exists but cannot be opened
     */
    Optional<IPartitionReader> openExisting(Path path) throws IOException;

    /**
     * Creates a writer producing a new file at {@code stagingPath}.
     *
     * @param stagingPath output path; any existing file there is overwritten on finish
     * @return a writer
     * @throws IOException if the writer cannot be created
     */
    IPartitionWriter create(Path stagingPath) throws IOException;

    /**
     * Lists the auxiliary files a writer for {@code stagingPath} may leave behind when the
     * process dies before the writer is closed.
     *
     * @param stagingPath output path of the writer
     * @return paths that are safe to delete before the next merge of the same partition
     */
    List<Path> workFiles(Path stagingPath);
}
