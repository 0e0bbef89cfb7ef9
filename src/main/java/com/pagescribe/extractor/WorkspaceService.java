package com.pagescribe.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Creates timestamped run directories and writes their metadata, config snapshot and error reports.
 * <p>
 * Layout of a run directory:
 * <pre>
 * &lt;root&gt;/&lt;yyyyMMdd_HHmmss&gt;/
 *     &lt;yyyyMMdd_HHmmss&gt;_&lt;runName&gt;.csv|.jsonl
 *     run.log
 *     metadata.json
 *     config_snapshot.json
 *     error_&lt;yyyyMMdd_HHmmss_SSS&gt;.txt   (only for aborted runs)
 * </pre>
 * Two runs started within the same second collide; the second fails with
 * {@link java.nio.file.FileAlreadyExistsException} and is not retried.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class WorkspaceService implements WorkspaceServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(WorkspaceService.class);

    static final DateTimeFormatter RUN_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final DateTimeFormatter ERROR_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Clock clock;

    public WorkspaceService() {
        this(Clock.systemDefaultZone());
    }

    public WorkspaceService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RunWorkspace createRun(Path root, ExtractionConfig config) throws IOException {
        Files.createDirectories(root);
        Instant createdAt = clock.instant();
        String timestamp = LocalDateTime.ofInstant(createdAt, clock.getZone()).format(RUN_STAMP);
        Path dir = Files.createDirectory(root.resolve(timestamp));

        RunLogger runLogger = new RunLogger(dir.resolve(RunWorkspace.LOG_FILE), clock);
        RunWorkspace workspace = new RunWorkspace(dir, timestamp, config.runName(), createdAt, runLogger);

        Map<String, Object> snapshot = config.toSnapshot();
        writeJson(dir.resolve(RunWorkspace.CONFIG_SNAPSHOT_FILE), snapshot);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("createdAt", createdAt.toString());
        metadata.put("runName", config.runName());
        metadata.put("schema", describeSchema(config.schemaResource()));
        metadata.put("config", snapshot);
        writeJson(dir.resolve(RunWorkspace.METADATA_FILE), metadata);

        runLogger.log("Created run workspace " + dir);
        return workspace;
    }

    @Override
    public Path writeError(RunWorkspace workspace, Throwable error) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        Path report = workspace.directory().resolve("error_" + now.format(ERROR_STAMP) + ".txt");
        String text = "time: " + now + "\n"
            + "run: " + workspace.directory() + "\n"
            + "error: " + error + "\n\n"
            + RunLogger.stackTrace(error);
        Files.writeString(report, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        logger.error("Wrote error report {}", report);
        return report;
    }

    @Override
    public Optional<Path> findLatestDataset(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }
        List<Path> runs = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory).forEach(runs::add);
        }
        runs.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        for (Path run : runs) {
            Optional<Path> dataset = datasetIn(run);
            if (dataset.isPresent()) {
                return dataset;
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> datasetIn(Path run) throws IOException {
        try (Stream<Path> files = Files.list(run)) {
            return files
                .filter(Files::isRegularFile)
                .filter(WorkspaceService::isDatasetFile)
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()))
                .findFirst();
        }
    }

    private static boolean isDatasetFile(Path file) {
        try {
            DatasetFormat.fromPath(file);
            return true;
        } catch (UnsupportedDatasetFormatException e) {
            return false;
        }
    }

    private static Map<String, Object> describeSchema(String resource) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("resource", resource);
        if (resource == null) {
            return schema;
        }
        try {
            JsonNode node = Json.MAPPER.readTree(ClasspathResources.read(resource));
            schema.put("title", node.path("title").asText(null));
            schema.put("version", node.path("version").asText(null));
        } catch (IOException e) {
            // schema details are optional in metadata
            logger.warn("Could not read schema {} for run metadata: {}", resource, e.getMessage());
        }
        return schema;
    }

    private static void writeJson(Path file, Object value) throws IOException {
        Files.writeString(file, Json.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value),
            StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }
}
