package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Interface for creating run workspaces and persisting their side files.
 */
public interface WorkspaceServiceInterface {

    /**
     * Creates {@code <root>/<timestamp>}, writes the config snapshot and metadata, and opens the run log.
     * @param root output root, created if missing
     * @param config effective configuration to snapshot
     * @return the new workspace
     * @throws java.nio.file.FileAlreadyExistsException if another run started within the same second
     * @throws IOException on any other file-system failure
     */
    RunWorkspace createRun(Path root, ExtractionConfig config) throws IOException;

    /**
     * Writes a standalone, timestamped error report into the workspace.
     * @param workspace run workspace
     * @param error the error that ended the run
     * @return path of the report
     * @throws IOException if the report cannot be written
     */
    Path writeError(RunWorkspace workspace, Throwable error) throws IOException;

    /**
     * Finds the dataset of the most recent run under {@code root}.
     * @param root output root
     * @return dataset path of the newest run directory that contains one
     * @throws IOException if the root cannot be listed
     */
    Optional<Path> findLatestDataset(Path root) throws IOException;
}
