package com.pagescribe.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagescribe.preprocess.ImageSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Run configuration, built once at start-up and handed to every component that needs it.
 * <p>
 * Values come from a JSON file (see {@link #load(Path)}); keys missing from the file keep their
 * {@link #defaults() default}. A few keys can be overridden from the environment or JVM system
 * properties, environment first, e.g. {@code PAGESCRIBE_CONCURRENCY=4}.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public record ExtractionConfig(
    Path inputRoot,
    Path outputRoot,
    String runName,
    List<String> inputExtensions,
    int concurrency,
    int flushEvery,
    String outputFormat,
    char delimiter,
    String model,
    String endpoint,
    String apiKeyEnv,
    int requestTimeoutSeconds,
    String schemaResource,
    String prompt,
    ImageSettings image
) {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

    public static final String DEFAULT_PROMPT_RESOURCE = "prompts/primary.txt";

    public ExtractionConfig {
        inputExtensions = inputExtensions == null ? List.of() : List.copyOf(inputExtensions);
        image = image == null ? ImageSettings.defaults() : image;
    }

    /**
     * Defaults used for every key the config file leaves out.
     */
    public static ExtractionConfig defaults() {
        return new ExtractionConfig(
            null,
            Path.of("runs"),
            "dataset",
            List.of("png", "jpg", "jpeg", "tif", "tiff"),
            8,
            25,
            "csv",
            '$',
            "gemini-2.5-flash",
            "https://generativelanguage.googleapis.com/v1beta",
            "GEMINI_API_KEY",
            300,
            "schema/journal.schema.json",
            null,
            ImageSettings.defaults()
        );
    }

    /**
     * Reads a JSON config file and applies environment/system-property overrides.
     * @param file config file
     * @return the effective configuration (not yet validated)
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public static ExtractionConfig load(Path file) throws IOException {
        JsonNode root = Json.MAPPER.readTree(Files.readString(file));
        if (root == null || !root.isObject()) {
            throw new IOException("Config file " + file + " does not contain a JSON object");
        }
        ExtractionConfig config = fromJson(root).withOverrides(ExtractionConfig::envOrProp);
        logger.info("Loaded configuration from {}", file);
        return config;
    }

    /**
     * Builds a configuration from a parsed JSON object, falling back to defaults key by key.
     */
    public static ExtractionConfig fromJson(JsonNode root) {
        ExtractionConfig d = defaults();
        JsonNode imageNode = root.path("image");
        ImageSettings di = d.image();
        ImageSettings image = new ImageSettings(
            imageNode.path("maxDim").asInt(di.maxDim()),
            imageNode.has("margins") ? intList(imageNode.get("margins")) : di.margins(),
            imageNode.path("contrastFactor").asDouble(di.contrastFactor()),
            imageNode.path("outputFormat").asText(di.outputFormat())
        );
        String delimiter = root.path("delimiter").asText(String.valueOf(d.delimiter()));
        if (delimiter.length() != 1) {
            throw new ConfigurationException("delimiter must be a single character, got '" + delimiter + "'");
        }
        return new ExtractionConfig(
            root.hasNonNull("inputRoot") ? Path.of(root.get("inputRoot").asText()) : d.inputRoot(),
            root.hasNonNull("outputRoot") ? Path.of(root.get("outputRoot").asText()) : d.outputRoot(),
            root.path("runName").asText(d.runName()),
            root.has("inputExtensions") ? textList(root.get("inputExtensions")) : d.inputExtensions(),
            root.path("concurrency").asInt(d.concurrency()),
            root.path("flushEvery").asInt(d.flushEvery()),
            root.path("outputFormat").asText(d.outputFormat()),
            delimiter.charAt(0),
            root.path("model").asText(d.model()),
            root.path("endpoint").asText(d.endpoint()),
            root.path("apiKeyEnv").asText(d.apiKeyEnv()),
            root.path("requestTimeoutSeconds").asInt(d.requestTimeoutSeconds()),
            root.path("schemaResource").asText(d.schemaResource()),
            root.hasNonNull("prompt") ? root.get("prompt").asText() : d.prompt(),
            image
        );
    }

    /**
     * Applies overrides for the keys that commonly change between runs.
     * @param lookup returns the override for a variable name, or null when unset
     * @return a new configuration
     */
    public ExtractionConfig withOverrides(UnaryOperator<String> lookup) {
        String input = lookup.apply("PAGESCRIBE_INPUT_ROOT");
        String output = lookup.apply("PAGESCRIBE_OUTPUT_ROOT");
        String concurrencyValue = lookup.apply("PAGESCRIBE_CONCURRENCY");
        String flushValue = lookup.apply("PAGESCRIBE_FLUSH_EVERY");
        String format = lookup.apply("PAGESCRIBE_OUTPUT_FORMAT");
        String modelValue = lookup.apply("PAGESCRIBE_MODEL");
        return new ExtractionConfig(
            input != null ? Path.of(input) : inputRoot,
            output != null ? Path.of(output) : outputRoot,
            runName,
            inputExtensions,
            concurrencyValue != null ? parseInt("PAGESCRIBE_CONCURRENCY", concurrencyValue) : concurrency,
            flushValue != null ? parseInt("PAGESCRIBE_FLUSH_EVERY", flushValue) : flushEvery,
            format != null ? format : outputFormat,
            delimiter,
            modelValue != null ? modelValue : model,
            endpoint,
            apiKeyEnv,
            requestTimeoutSeconds,
            schemaResource,
            prompt,
            image
        );
    }

    /**
     * Copy with a different input root; used by tests and by callers that pick the folder at runtime.
     */
    public ExtractionConfig withInputRoot(Path root) {
        return new ExtractionConfig(root, outputRoot, runName, inputExtensions, concurrency, flushEvery, outputFormat,
            delimiter, model, endpoint, apiKeyEnv, requestTimeoutSeconds, schemaResource, prompt, image);
    }

    public ExtractionConfig withOutputRoot(Path root) {
        return new ExtractionConfig(inputRoot, root, runName, inputExtensions, concurrency, flushEvery, outputFormat,
            delimiter, model, endpoint, apiKeyEnv, requestTimeoutSeconds, schemaResource, prompt, image);
    }

    public ExtractionConfig withConcurrency(int value) {
        return new ExtractionConfig(inputRoot, outputRoot, runName, inputExtensions, value, flushEvery, outputFormat,
            delimiter, model, endpoint, apiKeyEnv, requestTimeoutSeconds, schemaResource, prompt, image);
    }

    public ExtractionConfig withFlushEvery(int value) {
        return new ExtractionConfig(inputRoot, outputRoot, runName, inputExtensions, concurrency, value, outputFormat,
            delimiter, model, endpoint, apiKeyEnv, requestTimeoutSeconds, schemaResource, prompt, image);
    }

    public ExtractionConfig withOutputFormat(String value) {
        return new ExtractionConfig(inputRoot, outputRoot, runName, inputExtensions, concurrency, flushEvery, value,
            delimiter, model, endpoint, apiKeyEnv, requestTimeoutSeconds, schemaResource, prompt, image);
    }

    /**
     * Fails fast on settings that would make a run pointless or unsafe.
     * @throws ConfigurationException describing the first problem found
     */
    public void validate() {
        if (inputRoot == null) {
            throw new ConfigurationException("inputRoot is not configured");
        }
        if (!Files.isDirectory(inputRoot)) {
            throw new ConfigurationException("inputRoot does not exist or is not a directory: " + inputRoot);
        }
        if (outputRoot == null) {
            throw new ConfigurationException("outputRoot is not configured");
        }
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency must be >= 1, got " + concurrency);
        }
        if (flushEvery < 1) {
            throw new ConfigurationException("flushEvery must be >= 1, got " + flushEvery);
        }
        if (runName == null || runName.isBlank()) {
            throw new ConfigurationException("runName must not be blank");
        }
        try {
            datasetFormat();
        } catch (UnsupportedDatasetFormatException e) {
            throw new ConfigurationException("outputFormat is not supported: " + outputFormat, e);
        }
    }

    public DatasetFormat datasetFormat() {
        return DatasetFormat.fromName(outputFormat);
    }

    /**
     * Plain map view of the configuration, written to the run workspace as the config snapshot.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> image = new LinkedHashMap<>();
        image.put("maxDim", this.image.maxDim());
        image.put("margins", this.image.margins());
        image.put("contrastFactor", this.image.contrastFactor());
        image.put("outputFormat", this.image.outputFormat());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("inputRoot", inputRoot == null ? null : inputRoot.toString());
        out.put("outputRoot", outputRoot == null ? null : outputRoot.toString());
        out.put("runName", runName);
        out.put("inputExtensions", inputExtensions);
        out.put("concurrency", concurrency);
        out.put("flushEvery", flushEvery);
        out.put("outputFormat", outputFormat);
        out.put("delimiter", String.valueOf(delimiter));
        out.put("model", model);
        out.put("endpoint", endpoint);
        out.put("apiKeyEnv", apiKeyEnv);
        out.put("requestTimeoutSeconds", requestTimeoutSeconds);
        out.put("schemaResource", schemaResource);
        out.put("prompt", prompt);
        out.put("image", image);
        return out;
    }

    static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        return System.getProperty(key);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : node) out.add(n.asText().toLowerCase(Locale.ROOT));
        return out;
    }

    private static List<Integer> intList(JsonNode node) {
        List<Integer> out = new ArrayList<>();
        for (JsonNode n : node) out.add(n.asInt());
        return out;
    }
}
