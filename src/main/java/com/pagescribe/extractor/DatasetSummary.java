package com.pagescribe.extractor;

import java.util.Set;

/**
 * What a reader learned about an existing dataset.
 *
 * @param format encoding of the file
 * @param knownIdentities raw {@code file_name} values, not yet normalised
 * @param rowCount rows read (valid records for line-delimited files)
 */
public record DatasetSummary(DatasetFormat format, Set<String> knownIdentities, int rowCount) {

    public DatasetSummary {
        knownIdentities = Set.copyOf(knownIdentities);
    }
}
