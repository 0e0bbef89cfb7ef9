package com.pagescribe.extractor;

import java.nio.file.Path;

/**
 * Result of a completed run.
 *
 * @param workspace directory of the run
 * @param dataset dataset file written by the run
 * @param format its encoding
 * @param inputCount documents found under the input root
 * @param alreadyCovered input identities found in the continued dataset (0 for a fresh run)
 * @param scheduler counters of the extraction itself
 * @param coverage coverage report, only in verbose mode
 */
public record RunSummary(
    Path workspace,
    Path dataset,
    DatasetFormat format,
    int inputCount,
    int alreadyCovered,
    SchedulerReport scheduler,
    CoverageReport coverage
) {}
