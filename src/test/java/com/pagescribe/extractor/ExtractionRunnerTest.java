package com.pagescribe.extractor;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs with a fake extractor: fresh, aborted and continued.
 */
public class ExtractionRunnerTest {

    @TempDir
    Path dir;

    private Path input;
    private Path output;
    private ExtractionConfig config;
    private final DatasetService datasets = new DatasetService();
    private final Set<String> extracted = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void setUp() throws Exception {
        input = Files.createDirectories(dir.resolve("pages"));
        for (String name : List.of("a.png", "b.png", "c.png", "d.png")) {
            Files.createFile(input.resolve(name));
        }
        Files.createFile(input.resolve("notes.txt"));
        output = dir.resolve("runs");
        config = ExtractionConfig.defaults().withInputRoot(input).withOutputRoot(output)
            .withConcurrency(2).withFlushEvery(2);
    }

    private ExtractionRunner runner(String instant, DocumentExtractor extractor) {
        WorkspaceService workspaces = new WorkspaceService(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
        return new ExtractionRunner(config, datasets, workspaces, extractor, new LexicalFatalErrorClassifier());
    }

    private DocumentExtractor failingOn(String name, RuntimeException error) {
        return ref -> {
            extracted.add(Path.of(ref).getFileName().toString());
            if (ref.endsWith(name)) throw error;
            return Map.of("name", Path.of(ref).getFileName().toString());
        };
    }

    private static List<Path> errorReports(Path workspace) throws IOException {
        try (Stream<Path> files = Files.list(workspace)) {
            return files.filter(p -> p.getFileName().toString().startsWith("error_")).collect(Collectors.toList());
        }
    }

    @Test
    void testFreshRun() throws Exception {
        RunSummary summary = runner("2024-06-01T09:00:00Z", failingOn("none", null)).run(RunOptions.fresh());

        assertEquals(4, summary.inputCount());
        assertEquals(4, summary.scheduler().succeeded());
        assertEquals(DatasetFormat.TABLE, summary.format());
        assertEquals(output.resolve("20240601_090000/20240601_090000_dataset.csv"), summary.dataset());
        assertEquals(4, datasets.load(summary.dataset(), null).rowCount());
        assertTrue(errorReports(summary.workspace()).isEmpty());
        assertNull(summary.coverage());
        assertEquals(Set.of("a.png", "b.png", "c.png", "d.png"), extracted);
    }

    @Test
    void testLocalFailureStillCompletesRun() throws Exception {
        RunSummary summary = runner("2024-06-01T09:00:00Z", failingOn("b.png", new IllegalStateException("blurred")))
            .run(new RunOptions(Optional.empty(), true));

        assertEquals(3, summary.scheduler().succeeded());
        assertEquals(1, summary.scheduler().failed());
        assertEquals(3, summary.coverage().coveredCount());
        assertEquals(List.of(input.resolve("b.png").toString()), summary.coverage().missing());
        assertTrue(errorReports(summary.workspace()).isEmpty());
    }

    @Test
    void testFatalErrorWritesExactlyOneErrorReport() throws Exception {
        ExtractionRunner runner = runner("2024-06-01T09:00:00Z",
            failingOn("c.png", new RuntimeException("429 Too Many Requests: quota exhausted")));

        assertThrows(ExtractionAbortedException.class, () -> runner.run(RunOptions.fresh()));

        Path workspace = output.resolve("20240601_090000");
        assertEquals(1, errorReports(workspace).size());
        assertTrue(Files.readString(errorReports(workspace).get(0)).contains("quota exhausted"));
        Path dataset = workspace.resolve("20240601_090000_dataset.csv");
        if (Files.exists(dataset)) {
            assertFalse(datasets.load(dataset, null).knownIdentities().contains(input.resolve("c.png").toString()));
        }
        assertTrue(Files.readString(workspace.resolve("run.log")).contains("error report written"));
    }

    @Test
    void testContinuationExtractsOnlyMissingDocuments() throws Exception {
        RunSummary first = runner("2024-06-01T09:00:00Z", failingOn("b.png", new IllegalStateException("blurred")))
            .run(RunOptions.fresh());
        assertEquals(3, first.scheduler().succeeded());

        extracted.clear();
        RunSummary second = runner("2024-06-01T10:00:00Z", failingOn("none", null))
            .run(new RunOptions(Optional.of(first.dataset()), true));

        assertEquals(Set.of("b.png"), extracted);
        assertEquals(3, second.alreadyCovered());
        assertEquals(output.resolve("20240601_100000/20240601_100000_dataset.csv"), second.dataset());
        assertEquals(4, datasets.load(second.dataset(), null).rowCount());
        assertTrue(second.coverage().complete());
        // the earlier run's dataset is left untouched
        assertEquals(3, datasets.load(first.dataset(), null).rowCount());
        long headers = Files.readAllLines(second.dataset()).stream().filter(l -> l.startsWith("file_name")).count();
        assertEquals(1, headers);
    }

    @Test
    void testContinuationKeepsEarlierFormat() throws Exception {
        config = config.withOutputFormat("jsonl");
        RunSummary first = runner("2024-06-01T09:00:00Z", failingOn("d.png", new IllegalStateException("blurred")))
            .run(RunOptions.fresh());
        config = config.withOutputFormat("csv");

        RunSummary second = runner("2024-06-01T10:00:00Z", failingOn("none", null))
            .run(new RunOptions(Optional.of(first.dataset()), false));

        assertEquals(DatasetFormat.LINE_DELIMITED, second.format());
        assertTrue(second.dataset().toString().endsWith(".jsonl"));
        assertEquals(4, datasets.load(second.dataset(), null).rowCount());
    }

    @Test
    void testContinuingFullyCoveredDatasetExtractsNothing() throws Exception {
        RunSummary first = runner("2024-06-01T09:00:00Z", failingOn("none", null)).run(RunOptions.fresh());
        extracted.clear();

        RunSummary second = runner("2024-06-01T10:00:00Z", failingOn("none", null))
            .run(new RunOptions(Optional.of(first.dataset()), false));

        assertTrue(extracted.isEmpty());
        assertEquals(0, second.scheduler().dispatched());
        assertEquals(-1L, Files.mismatch(first.dataset(), second.dataset()));
    }

    @Test
    void testMissingContinuationDatasetFailsBeforeWorkspace() {
        ExtractionRunner runner = runner("2024-06-01T09:00:00Z", failingOn("none", null));
        assertThrows(NoSuchFileException.class,
            () -> runner.run(new RunOptions(Optional.of(dir.resolve("nope.csv")), false)));
        assertFalse(Files.exists(output));
    }

    @Test
    void testInvalidConfigurationFailsBeforeWorkspace() {
        config = config.withConcurrency(0);
        ExtractionRunner runner = runner("2024-06-01T09:00:00Z", failingOn("none", null));
        assertThrows(ConfigurationException.class, () -> runner.run(RunOptions.fresh()));
        assertFalse(Files.exists(output));
        assertTrue(extracted.isEmpty());
    }

    @Test
    void testSameSecondRunsCollide() throws Exception {
        runner("2024-06-01T09:00:00Z", failingOn("none", null)).run(RunOptions.fresh());
        ExtractionRunner again = runner("2024-06-01T09:00:00Z", failingOn("none", null));
        assertThrows(java.nio.file.FileAlreadyExistsException.class, () -> again.run(RunOptions.fresh()));
    }
}
