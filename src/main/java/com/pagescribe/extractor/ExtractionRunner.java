package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Drives one run end to end:
 * validate config, collect inputs, create the workspace, plan a continuation if asked, extract, and
 * optionally report coverage. Any failure after the workspace exists leaves an error report in it
 * and is rethrown; whatever rows were flushed before stay in the dataset.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class ExtractionRunner {

    private final ExtractionConfig config;
    private final WorkspaceServiceInterface workspaces;
    private final DocumentExtractor extractor;
    private final ResumePlanner planner;
    private final ExtractionScheduler scheduler;

    public ExtractionRunner(ExtractionConfig config, DatasetServiceInterface datasets,
                            WorkspaceServiceInterface workspaces, DocumentExtractor extractor,
                            FatalErrorClassifier classifier) {
        this.config = config;
        this.workspaces = workspaces;
        this.extractor = extractor;
        this.planner = new ResumePlanner(datasets, new PathIdentityResolver());
        this.scheduler = new ExtractionScheduler(datasets, classifier, Math.max(1, config.flushEvery()));
    }

    /**
     * @param options continuation and verbosity switches
     * @return summary of the finished run
     * @throws ConfigurationException before anything is written, if the configuration is unusable
     * @throws ExtractionAbortedException after a fatal extraction error
     * @throws IOException on infrastructure failures (workspace collision, disk errors)
     */
    public RunSummary run(RunOptions options) throws IOException {
        config.validate();
        Path root = config.inputRoot();
        DatasetFormat configured = config.datasetFormat();
        if (options.continueFrom().isPresent() && !Files.isRegularFile(options.continueFrom().get())) {
            throw new NoSuchFileException(options.continueFrom().get().toString(), null, "dataset to continue not found");
        }
        List<String> inputs = InputCollector.collect(root, config.inputExtensions());

        RunWorkspace workspace = workspaces.createRun(config.outputRoot(), config);
        RunLogger log = workspace.logger();
        Path output = workspace.datasetPath(configured);
        DatasetFormat format = configured;
        try {
            log.log("Found " + inputs.size() + " input document(s) under " + root);
            List<String> todo = inputs;
            boolean headerWritten = false;
            int alreadyCovered = 0;
            if (options.continueFrom().isPresent()) {
                ResumePlan plan = planner.plan(inputs, options.continueFrom().get(), root, configured, workspace);
                todo = plan.prunedInputs();
                format = plan.outputFormat();
                output = plan.outputPath();
                headerWritten = plan.headerWritten();
                alreadyCovered = plan.alreadyCovered();
            }

            SchedulerReport report = scheduler.run(todo, config.concurrency(), extractor,
                new DatasetTarget(output, format, headerWritten), log);

            CoverageReport coverage = options.verbose() ? coverage(output, format, inputs, root, log) : null;
            log.log("Run complete: dataset " + output);
            return new RunSummary(workspace.directory(), output, format, inputs.size(), alreadyCovered, report, coverage);
        } catch (IOException | RuntimeException e) {
            if (options.verbose()) {
                try {
                    coverage(output, format, inputs, root, log);
                } catch (IOException | RuntimeException coverageError) {
                    e.addSuppressed(coverageError);
                }
            }
            try {
                Path report = workspaces.writeError(workspace, e);
                log.log("Run failed, error report written to " + report, e);
            } catch (IOException reportError) {
                e.addSuppressed(reportError);
            }
            throw e;
        }
    }

    private CoverageReport coverage(Path output, DatasetFormat format, List<String> inputs, Path root,
                                    RunLogger log) throws IOException {
        if (!Files.exists(output)) {
            log.warn("No dataset was written, so none of the " + inputs.size() + " input document(s) are covered");
            return new CoverageReport(inputs.size(), 0, inputs);
        }
        return planner.reportCoverage(output, format, inputs, root, log);
    }
}
