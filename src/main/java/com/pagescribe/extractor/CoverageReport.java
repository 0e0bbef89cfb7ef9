package com.pagescribe.extractor;

import java.util.List;

/**
 * How many inputs a dataset covers.
 *
 * @param inputCount distinct input identities
 * @param coveredCount input identities present in the dataset
 * @param missing inputs (as given) with no row in the dataset
 */
public record CoverageReport(int inputCount, int coveredCount, List<String> missing) {

    public CoverageReport {
        missing = List.copyOf(missing);
    }

    public boolean complete() {
        return missing.isEmpty();
    }
}
