package com.pagescribe.extractor;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Outcome of planning a continuation run.
 *
 * @param prunedInputs inputs not yet covered by the earlier dataset, in input order
 * @param outputFormat encoding inherited from the earlier dataset
 * @param outputPath the new run's dataset, already seeded with a copy of the earlier one
 * @param seededRowCount rows carried over
 * @param priorIdentities normalised identities of the earlier dataset
 * @param alreadyCovered number of input identities present in the earlier dataset
 * @param headerWritten whether the seeded file already carries a table header
 */
public record ResumePlan(
    List<String> prunedInputs,
    DatasetFormat outputFormat,
    Path outputPath,
    int seededRowCount,
    Set<String> priorIdentities,
    int alreadyCovered,
    boolean headerWritten
) {
    public ResumePlan {
        prunedInputs = List.copyOf(prunedInputs);
        priorIdentities = Set.copyOf(priorIdentities);
    }
}
