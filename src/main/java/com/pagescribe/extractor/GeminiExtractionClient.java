package com.pagescribe.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagescribe.preprocess.ImagePreprocessor;
import com.pagescribe.preprocess.ImageSettings;
import com.pagescribe.preprocess.PreprocessedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Extracts one page through the Gemini {@code generateContent} REST endpoint.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Preprocesses the page image on the calling worker thread.</li>
 *   <li>Sends the image inline together with the prompt and asks for JSON matching the record schema.</li>
 *   <li>Parses the first candidate's text as a JSON object.</li>
 * </ul>
 * Error handling: non-2xx responses become {@link GenerationServiceException} with the HTTP code and the
 * service's error status (e.g. {@code 429 RESOURCE_EXHAUSTED}), which the fatal-error classifier reads.
 * Blocked, empty or non-JSON answers are document-local failures.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class GeminiExtractionClient implements DocumentExtractor {
    private static final Logger logger = LoggerFactory.getLogger(GeminiExtractionClient.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final String prompt;
    private final JsonNode schema;
    private final ImageSettings imageSettings;
    private final Duration timeout;
    private final ImagePreprocessor preprocessor;
    private final HttpClient http;

    public GeminiExtractionClient(String endpoint, String model, String apiKey, String prompt, JsonNode schema,
                                  ImageSettings imageSettings, Duration timeout,
                                  ImagePreprocessor preprocessor, HttpClient http) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.prompt = prompt;
        this.schema = schema;
        this.imageSettings = imageSettings;
        this.timeout = timeout;
        this.preprocessor = preprocessor;
        this.http = http;
    }

    /**
     * Builds a client from the run configuration. The API key is read from the environment variable
     * named by {@code apiKeyEnv}, falling back to a JVM system property of the same name.
     * @param config run configuration
     * @return a ready client
     * @throws ConfigurationException if the key, the schema or the prompt cannot be found
     */
    public static GeminiExtractionClient fromConfig(ExtractionConfig config) {
        String key = ExtractionConfig.envOrProp(config.apiKeyEnv());
        if (key == null || key.isBlank()) {
            throw new ConfigurationException("No API key: set the " + config.apiKeyEnv() + " environment variable");
        }
        JsonNode schema;
        String prompt;
        try {
            schema = Json.MAPPER.readTree(ClasspathResources.read(config.schemaResource()));
            prompt = config.prompt() != null ? config.prompt() : ClasspathResources.read(ExtractionConfig.DEFAULT_PROMPT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot load schema or prompt: " + e.getMessage(), e);
        }
        Duration timeout = config.requestTimeoutSeconds() > 0 ? Duration.ofSeconds(config.requestTimeoutSeconds()) : null;
        HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
        return new GeminiExtractionClient(config.endpoint(), config.model(), key, prompt, schema, config.image(),
            timeout, new ImagePreprocessor(), http);
    }

    @Override
    public Map<String, Object> extract(String documentPath) throws IOException, InterruptedException {
        PreprocessedImage image = preprocessor.preprocess(Path.of(documentPath), imageSettings);
        String body = Json.MAPPER.writeValueAsString(requestBody(image));

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(endpoint + "/models/" + model + ":generateContent"))
            .header("Content-Type", "application/json")
            .header("x-goog-api-key", apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (timeout != null) request.timeout(timeout);

        long start = System.currentTimeMillis();
        HttpResponse<String> response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        logger.debug("generateContent for {} returned HTTP {} in {}ms", documentPath, response.statusCode(),
            System.currentTimeMillis() - start);

        if (response.statusCode() / 100 != 2) {
            throw httpError(response.statusCode(), response.body());
        }
        return parseResponse(response.body());
    }

    ObjectNode requestBody(PreprocessedImage image) {
        ObjectNode root = Json.MAPPER.createObjectNode();
        ArrayNode parts = root.putArray("contents").addObject().putArray("parts");
        ObjectNode inline = parts.addObject().putObject("inlineData");
        inline.put("mimeType", image.mimeType());
        inline.put("data", Base64.getEncoder().encodeToString(image.bytes()));
        parts.addObject().put("text", prompt);

        ObjectNode generation = root.putObject("generationConfig");
        generation.put("responseMimeType", "application/json");
        if (schema != null) {
            generation.set("responseJsonSchema", schema);
        }
        return root;
    }

    /**
     * Extracts the record from a {@code generateContent} response body.
     * @throws GenerationServiceException if the answer is blocked, empty or not a JSON object
     */
    static Map<String, Object> parseResponse(String body) throws JsonProcessingException {
        JsonNode root = Json.MAPPER.readTree(body);
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String reason = root.path("promptFeedback").path("blockReason").asText("no candidates");
            throw new GenerationServiceException("Generation returned no answer: " + reason);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        String cleaned = stripFences(text.toString());
        if (cleaned.isEmpty()) {
            String finish = candidates.get(0).path("finishReason").asText("unknown");
            throw new GenerationServiceException("Generation returned empty text (finishReason " + finish + ")");
        }
        JsonNode parsed;
        try {
            parsed = Json.MAPPER.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new GenerationServiceException("Generation answer is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (parsed == null || !parsed.isObject()) {
            throw new GenerationServiceException("Generation answer is not a JSON object");
        }
        return Json.MAPPER.convertValue(parsed, RECORD_TYPE);
    }

    static GenerationServiceException httpError(int status, String body) {
        String serviceStatus = null;
        String message = body;
        try {
            JsonNode error = Json.MAPPER.readTree(body).path("error");
            if (error.isObject()) {
                serviceStatus = error.path("status").asText(null);
                message = error.path("message").asText(body);
            }
        } catch (JsonProcessingException e) {
            logger.debug("Error body of HTTP {} is not JSON", status);
        }
        return new GenerationServiceException(status, serviceStatus, message);
    }

    private static String stripFences(String text) {
        return text.replace("```json", "").replace("```", "").trim();
    }
}
