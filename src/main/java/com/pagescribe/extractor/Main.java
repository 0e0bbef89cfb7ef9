package com.pagescribe.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command-line entry point.
 * <pre>
 * java -jar page-scribe.jar --config extract.json [--continue &lt;dataset&gt;|latest] [--verbose]
 * </pre>
 * Exit status: 0 on success, 1 when the run fails or aborts, 2 on a usage error.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: page-scribe --config <file.json> [--continue <dataset>|latest] [--verbose]";

    /**
     * Parsed command line.
     */
    record Arguments(Optional<Path> config, Optional<String> continueFrom, boolean verbose, boolean help) {}

    /**
     * Main application entry point; the only place that terminates the process.
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arguments parsed;
        try {
            parsed = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        if (parsed.help()) {
            System.out.println(USAGE);
            return EXIT_OK;
        }
        try {
            ExtractionConfig config = parsed.config().isPresent()
                ? ExtractionConfig.load(parsed.config().get())
                : ExtractionConfig.defaults().withOverrides(ExtractionConfig::envOrProp);
            config.validate();

            // services are created here and passed by interface
            DatasetServiceInterface datasets = new DatasetService(config.delimiter());
            WorkspaceServiceInterface workspaces = new WorkspaceService();
            DocumentExtractor extractor = GeminiExtractionClient.fromConfig(config);
            FatalErrorClassifier classifier = new LexicalFatalErrorClassifier();

            Optional<Path> continueFrom = resolveContinuation(parsed.continueFrom(), config, workspaces);
            ExtractionRunner runner = new ExtractionRunner(config, datasets, workspaces, extractor, classifier);
            RunSummary summary = runner.run(new RunOptions(continueFrom, parsed.verbose()));
            logger.info("Wrote {} new record(s) to {} ({} failed)", summary.scheduler().succeeded(),
                summary.dataset(), summary.scheduler().failed());
            return EXIT_OK;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (ExtractionAbortedException e) {
            logger.error("Run aborted: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return EXIT_FAILED;
        } catch (Exception e) {
            logger.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    static Arguments parse(String[] args) {
        Path config = null;
        String continueFrom = null;
        boolean verbose = false;
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i].trim();
            switch (arg) {
                case "--config":
                case "-c":
                    config = Path.of(value(args, ++i, arg));
                    break;
                case "--continue":
                    continueFrom = value(args, ++i, arg);
                    break;
                case "--verbose":
                case "-v":
                    verbose = true;
                    break;
                case "--help":
                case "-h":
                    help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return new Arguments(Optional.ofNullable(config), Optional.ofNullable(continueFrom), verbose, help);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length || args[i].isBlank()) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[i].trim();
    }

    private static Optional<Path> resolveContinuation(Optional<String> continueFrom, ExtractionConfig config,
                                                      WorkspaceServiceInterface workspaces) throws IOException {
        if (continueFrom.isEmpty()) {
            return Optional.empty();
        }
        if (!continueFrom.get().equalsIgnoreCase("latest")) {
            return Optional.of(Path.of(continueFrom.get()));
        }
        Optional<Path> latest = workspaces.findLatestDataset(config.outputRoot());
        if (latest.isEmpty()) {
            throw new ConfigurationException("--continue latest: no earlier dataset under " + config.outputRoot());
        }
        logger.info("Continuing the latest dataset {}", latest.get());
        return latest;
    }
}
