package com.pagescribe.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagescribe.preprocess.ImagePreprocessor;
import com.pagescribe.preprocess.ImageSettings;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client tests against a local stub of the generateContent endpoint.
 */
public class GeminiExtractionClientTest {

    @TempDir
    Path dir;

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> apiKeyHeader = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{}";

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1beta/models/test-model:generateContent", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            apiKeyHeader.set(exchange.getRequestHeaders().getFirst("x-goog-api-key"));
            byte[] out = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private GeminiExtractionClient client() throws Exception {
        JsonNode schema = Json.MAPPER.readTree("{\"type\":\"object\",\"properties\":{\"name\":{\"type\":\"string\"}}}");
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1beta/";
        return new GeminiExtractionClient(endpoint, "test-model", "secret-key", "Read the page.", schema,
            ImageSettings.defaults(), Duration.ofSeconds(10), new ImagePreprocessor(), HttpClient.newHttpClient());
    }

    private Path page() throws Exception {
        BufferedImage img = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);
        Path file = dir.resolve("page.png");
        ImageIO.write(img, "PNG", file.toFile());
        return file;
    }

    private static String answer(String text) throws Exception {
        return "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":" + Json.MAPPER.writeValueAsString(text)
            + "}]},\"finishReason\":\"STOP\"}]}";
    }

    @Test
    void testExtractSendsImagePromptAndSchema() throws Exception {
        responseBody = answer("{\"name\": \"Hans\", \"age\": {\"num\": 4}}");

        Map<String, Object> fields = client().extract(page().toString());

        assertEquals("Hans", fields.get("name"));
        assertEquals(Map.of("num", 4), fields.get("age"));
        assertEquals("secret-key", apiKeyHeader.get());

        JsonNode sent = Json.MAPPER.readTree(requestBody.get());
        JsonNode parts = sent.path("contents").get(0).path("parts");
        assertEquals("image/png", parts.get(0).path("inlineData").path("mimeType").asText());
        assertFalse(parts.get(0).path("inlineData").path("data").asText().isEmpty());
        assertEquals("Read the page.", parts.get(1).path("text").asText());
        assertEquals("application/json", sent.path("generationConfig").path("responseMimeType").asText());
        assertEquals("object", sent.path("generationConfig").path("responseJsonSchema").path("type").asText());
    }

    @Test
    void testQuotaResponseIsFatal() throws Exception {
        status = 429;
        responseBody = "{\"error\":{\"code\":429,\"message\":\"You exceeded your current quota.\",\"status\":\"RESOURCE_EXHAUSTED\"}}";

        GenerationServiceException e = assertThrows(GenerationServiceException.class, () -> client().extract(page().toString()));

        assertEquals(429, e.getStatusCode());
        assertEquals("RESOURCE_EXHAUSTED", e.getServiceStatus());
        assertTrue(new LexicalFatalErrorClassifier().isFatal(e));
    }

    @Test
    void testServerErrorIsDocumentLocal() throws Exception {
        status = 500;
        responseBody = "{\"error\":{\"code\":500,\"message\":\"An internal error has occurred.\",\"status\":\"INTERNAL\"}}";

        GenerationServiceException e = assertThrows(GenerationServiceException.class, () -> client().extract(page().toString()));
        assertFalse(new LexicalFatalErrorClassifier().isFatal(e));
    }

    @Test
    void testMissingImageFailsBeforeAnyRequest() {
        assertThrows(java.nio.file.NoSuchFileException.class, () -> client().extract(dir.resolve("nope.png").toString()));
        assertNull(requestBody.get());
    }

    @Test
    void testParseResponseStripsCodeFences() throws Exception {
        Map<String, Object> fields = GeminiExtractionClient.parseResponse(answer("```json\n{\"name\": \"Karen\"}\n```"));
        assertEquals(Map.of("name", "Karen"), fields);
    }

    @Test
    void testParseResponseJoinsParts() throws Exception {
        String body = "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"{\\\"name\\\":\"},{\"text\":\"\\\"Ole\\\"}\"}]}}]}";
        assertEquals(Map.of("name", "Ole"), GeminiExtractionClient.parseResponse(body));
    }

    @Test
    void testParseResponseRejectsUnusableAnswers() {
        assertThrows(GenerationServiceException.class,
            () -> GeminiExtractionClient.parseResponse("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"));
        assertThrows(GenerationServiceException.class, () -> GeminiExtractionClient.parseResponse(answer("")));
        assertThrows(GenerationServiceException.class, () -> GeminiExtractionClient.parseResponse(answer("not json")));
        assertThrows(GenerationServiceException.class, () -> GeminiExtractionClient.parseResponse(answer("[1, 2]")));
    }

    @Test
    void testHttpErrorWithPlainBody() {
        GenerationServiceException e = GeminiExtractionClient.httpError(503, "Service Unavailable");
        assertEquals(503, e.getStatusCode());
        assertNull(e.getServiceStatus());
        assertEquals("HTTP 503: Service Unavailable", e.getMessage());
    }

    @Test
    void testFromConfigRequiresApiKey() {
        ExtractionConfig config = ExtractionConfig.defaults();
        config = new ExtractionConfig(config.inputRoot(), config.outputRoot(), config.runName(), config.inputExtensions(),
            config.concurrency(), config.flushEvery(), config.outputFormat(), config.delimiter(), config.model(),
            config.endpoint(), "PAGESCRIBE_TEST_UNSET_KEY", config.requestTimeoutSeconds(), config.schemaResource(),
            config.prompt(), config.image());
        ExtractionConfig finalConfig = config;
        assertThrows(ConfigurationException.class, () -> GeminiExtractionClient.fromConfig(finalConfig));
    }

    @Test
    void testFromConfigLoadsBundledSchemaAndPrompt() {
        System.setProperty("PAGESCRIBE_TEST_KEY", "k");
        try {
            ExtractionConfig d = ExtractionConfig.defaults();
            ExtractionConfig config = new ExtractionConfig(d.inputRoot(), d.outputRoot(), d.runName(), d.inputExtensions(),
                d.concurrency(), d.flushEvery(), d.outputFormat(), d.delimiter(), d.model(), d.endpoint(),
                "PAGESCRIBE_TEST_KEY", d.requestTimeoutSeconds(), d.schemaResource(), d.prompt(), d.image());
            assertNotNull(GeminiExtractionClient.fromConfig(config));
        } finally {
            System.clearProperty("PAGESCRIBE_TEST_KEY");
        }
    }
}
