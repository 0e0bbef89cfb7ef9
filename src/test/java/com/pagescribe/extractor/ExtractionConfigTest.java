package com.pagescribe.extractor;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExtractionConfigTest {

    @TempDir
    Path dir;

    @Test
    void testMissingKeysKeepDefaults() throws Exception {
        ExtractionConfig config = ExtractionConfig.fromJson(Json.MAPPER.readTree("{\"concurrency\": 3}"));
        assertEquals(3, config.concurrency());
        assertEquals(25, config.flushEvery());
        assertEquals('$', config.delimiter());
        assertEquals(DatasetFormat.TABLE, config.datasetFormat());
        assertEquals(3000, config.image().maxDim());
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path input = Files.createDirectories(dir.resolve("pages"));
        Path file = dir.resolve("extract.json");
        Files.writeString(file, "{\n"
            + "  \"inputRoot\": \"" + input.toString().replace("\\", "\\\\") + "\",\n"
            + "  \"outputRoot\": \"out\",\n"
            + "  \"runName\": \"journals\",\n"
            + "  \"inputExtensions\": [\"PNG\", \"tif\"],\n"
            + "  \"outputFormat\": \"jsonl\",\n"
            + "  \"delimiter\": \";\",\n"
            + "  \"image\": {\"maxDim\": 1500, \"margins\": [1, 2, 3, 4], \"contrastFactor\": 1.1}\n"
            + "}");

        ExtractionConfig config = ExtractionConfig.load(file);

        assertEquals(input, config.inputRoot());
        assertEquals(Path.of("out"), config.outputRoot());
        assertEquals("journals", config.runName());
        assertEquals(List.of("png", "tif"), config.inputExtensions());
        assertEquals(DatasetFormat.LINE_DELIMITED, config.datasetFormat());
        assertEquals(';', config.delimiter());
        assertEquals(List.of(1, 2, 3, 4), config.image().margins());
        assertEquals(1.1, config.image().contrastFactor(), 1e-9);
        assertEquals("PNG", config.image().outputFormat());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void testLoadRejectsNonObject() throws Exception {
        Path file = Files.writeString(dir.resolve("extract.json"), "[1, 2]");
        assertThrows(IOException.class, () -> ExtractionConfig.load(file));
    }

    @Test
    void testOverrides() {
        Map<String, String> env = Map.of(
            "PAGESCRIBE_CONCURRENCY", "2",
            "PAGESCRIBE_FLUSH_EVERY", " 10 ",
            "PAGESCRIBE_OUTPUT_FORMAT", "jsonl",
            "PAGESCRIBE_OUTPUT_ROOT", "elsewhere");
        ExtractionConfig config = ExtractionConfig.defaults().withOverrides(env::get);
        assertEquals(2, config.concurrency());
        assertEquals(10, config.flushEvery());
        assertEquals("jsonl", config.outputFormat());
        assertEquals(Path.of("elsewhere"), config.outputRoot());
        assertEquals("gemini-2.5-flash", config.model());
    }

    @Test
    void testNonNumericOverrideIsConfigurationError() {
        Map<String, String> env = Map.of("PAGESCRIBE_CONCURRENCY", "many");
        assertThrows(ConfigurationException.class, () -> ExtractionConfig.defaults().withOverrides(env::get));
    }

    @Test
    void testMultiCharacterDelimiterRejected() throws Exception {
        assertThrows(ConfigurationException.class,
            () -> ExtractionConfig.fromJson(Json.MAPPER.readTree("{\"delimiter\": \"$$\"}")));
    }

    @Test
    void testValidate() {
        ExtractionConfig base = ExtractionConfig.defaults().withInputRoot(dir);
        assertDoesNotThrow(base::validate);
        assertThrows(ConfigurationException.class, () -> ExtractionConfig.defaults().validate());
        assertThrows(ConfigurationException.class, () -> base.withInputRoot(dir.resolve("missing")).validate());
        assertThrows(ConfigurationException.class, () -> base.withConcurrency(0).validate());
        assertThrows(ConfigurationException.class, () -> base.withFlushEvery(0).validate());
        assertThrows(ConfigurationException.class, () -> base.withOutputFormat("parquet").validate());
    }

    @Test
    void testDatasetFormatNames() {
        assertEquals(DatasetFormat.TABLE, DatasetFormat.fromName(".CSV"));
        assertEquals(DatasetFormat.LINE_DELIMITED, DatasetFormat.fromName("ndjson"));
        assertEquals(DatasetFormat.LINE_DELIMITED, DatasetFormat.fromPath(Path.of("runs", "x_dataset.jsonl")));
        assertThrows(UnsupportedDatasetFormatException.class, () -> DatasetFormat.fromPath(Path.of("dataset")));
        assertThrows(UnsupportedDatasetFormatException.class, () -> DatasetFormat.fromName("xlsx"));
    }
}
