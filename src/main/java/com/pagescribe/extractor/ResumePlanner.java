package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Plans continuation runs and measures dataset coverage.
 * <p>
 * A continuation run skips every input whose identity already appears in an earlier dataset, appends to a
 * copy of that dataset and keeps its encoding, even if a different output format is configured now.
 * Identities are compared through {@link PathIdentityResolver}, so bare file names stored by older runs
 * still match absolute input paths.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class ResumePlanner {
    static final int MAX_MISSING_LOGGED = 20;

    private final DatasetServiceInterface datasets;
    private final PathIdentityResolver resolver;

    public ResumePlanner(DatasetServiceInterface datasets, PathIdentityResolver resolver) {
        this.datasets = datasets;
        this.resolver = resolver;
    }

    /**
     * Prunes the inputs against an existing dataset and seeds the new run's dataset with a copy of it.
     * @param inputs current input references
     * @param existingDataset dataset of an earlier run
     * @param root input root used to resolve bare names
     * @param configuredFormat format configured for this run; the existing dataset's format wins
     * @param workspace the new run's workspace
     * @return the plan
     * @throws java.nio.file.NoSuchFileException if the existing dataset is missing
     * @throws UnsupportedDatasetFormatException if its format cannot be determined
     * @throws IOException on read or copy failure
     */
    public ResumePlan plan(List<String> inputs, Path existingDataset, Path root,
                           DatasetFormat configuredFormat, RunWorkspace workspace) throws IOException {
        RunLogger log = workspace.logger();
        DatasetSummary existing = datasets.load(existingDataset, null);
        DatasetFormat format = existing.format();
        if (configuredFormat != null && configuredFormat != format) {
            log.log("Continuing " + existingDataset + ": keeping its " + format
                + " format instead of the configured " + configuredFormat);
        }

        Set<String> prior = resolver.buildIdentitySet(existing.knownIdentities(), root);
        List<String> pruned = prune(inputs, prior, root);
        int covered = intersectionSize(resolver.buildIdentitySet(inputs, root), prior);

        Path output = workspace.datasetPath(format);
        datasets.copyDataset(existingDataset, output);
        boolean headerWritten = format == DatasetFormat.TABLE && !DatasetFiles.isEmpty(output);

        log.log("Continuing from " + existingDataset + " (" + existing.rowCount() + " rows): "
            + covered + " input identities already covered, " + pruned.size() + " of " + inputs.size()
            + " document(s) left to extract");
        return new ResumePlan(pruned, format, output, existing.rowCount(), prior, covered, headerWritten);
    }

    /**
     * Inputs whose identity is not in {@code prior}, in their original order.
     */
    public List<String> prune(List<String> inputs, Set<String> prior, Path root) throws IOException {
        List<String> pruned = new ArrayList<>();
        for (String input : inputs) {
            if (Collections.disjoint(resolver.identityIds(input, root), prior)) {
                pruned.add(input);
            }
        }
        return pruned;
    }

    /**
     * Re-reads a dataset and compares it with the inputs.
     * @param dataset dataset file
     * @param format its format, or null to infer it
     * @param inputs input references
     * @param root input root
     * @return coverage of the inputs
     * @throws IOException on read failure
     */
    public CoverageReport coverage(Path dataset, DatasetFormat format, List<String> inputs, Path root) throws IOException {
        DatasetSummary summary = datasets.load(dataset, format);
        Set<String> present = resolver.buildIdentitySet(summary.knownIdentities(), root);
        Set<String> inputIds = resolver.buildIdentitySet(inputs, root);
        List<String> missing = prune(inputs, present, root);
        return new CoverageReport(inputIds.size(), intersectionSize(inputIds, present), missing);
    }

    /**
     * Logs coverage of the run's dataset. Partial coverage is a warning, never an error.
     */
    public CoverageReport reportCoverage(Path dataset, DatasetFormat format, List<String> inputs, Path root,
                                         RunLogger log) throws IOException {
        CoverageReport report = coverage(dataset, format, inputs, root);
        log.log("Coverage: " + report.coveredCount() + " of " + report.inputCount() + " input identities present in " + dataset);
        if (!report.complete()) {
            List<String> sample = report.missing().subList(0, Math.min(MAX_MISSING_LOGGED, report.missing().size()));
            log.warn(report.missing().size() + " input document(s) are not covered, e.g. " + sample);
        }
        return report;
    }

    private static int intersectionSize(Set<String> a, Set<String> b) {
        Set<String> both = new HashSet<>(a);
        both.retainAll(b);
        return both.size();
    }
}
