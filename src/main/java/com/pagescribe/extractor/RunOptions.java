package com.pagescribe.extractor;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-invocation switches that are not part of the persisted configuration.
 *
 * @param continueFrom dataset of an earlier run to continue, if any
 * @param verbose re-read the finished dataset and report coverage
 */
public record RunOptions(Optional<Path> continueFrom, boolean verbose) {

    public RunOptions {
        continueFrom = continueFrom == null ? Optional.empty() : continueFrom;
    }

    public static RunOptions fresh() {
        return new RunOptions(Optional.empty(), false);
    }
}
