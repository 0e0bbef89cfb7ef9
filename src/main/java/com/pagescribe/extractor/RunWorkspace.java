package com.pagescribe.extractor;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One run's output directory, named by its creation timestamp. Created once and never reused.
 *
 * @param directory {@code <outputRoot>/<timestamp>}
 * @param timestamp {@code yyyyMMdd_HHmmss}
 * @param runName dataset base name
 * @param createdAt creation instant
 * @param logger log bound to {@code run.log} in this directory
 */
public record RunWorkspace(Path directory, String timestamp, String runName, Instant createdAt, RunLogger logger) {

    public static final String LOG_FILE = "run.log";
    public static final String METADATA_FILE = "metadata.json";
    public static final String CONFIG_SNAPSHOT_FILE = "config_snapshot.json";

    /**
     * Path of the dataset file this run writes in the given encoding: {@code <timestamp>_<runName>.<ext>}.
     */
    public Path datasetPath(DatasetFormat format) {
        return directory.resolve(timestamp + "_" + runName + "." + format.extension());
    }
}
