package com.raditha.magpie.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Minimal client for the Gemini REST API, used for embeddings and explanations.
 * <p>
 * Configuration comes from the {@code ai_service} section of magpie.yml; the API key and the
 * endpoint fall back to the {@code GEMINI_API_KEY} and {@code AI_SERVICE_ENDPOINT} environment
 * variables.
 */
public class GeminiAIService {
    private static final Logger logger = LoggerFactory.getLogger(GeminiAIService.class);

    public static final String DEFAULT_ENDPOINT =
            "https://generativelanguage.googleapis.com/v1beta/models/{model}:{method}";
    public static final String DEFAULT_MODEL = "gemini-2.0-flash";
    public static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-004";

    private static final String MISSING_KEY =
            "AI service API key is required. Set GEMINI_API_KEY environment variable or configure ai_service.api_key in magpie.yml";

    private final HttpClient httpClient;
    private final Map<String, Object> config;

    /**
     * @throws IOException if no API key is configured
     */
    public GeminiAIService(Map<String, Object> config) throws IOException {
        this(config, null);
    }

    GeminiAIService(Map<String, Object> config, HttpClient httpClient) throws IOException {
        this.config = config == null ? Map.of() : config;

        // Validate API key is available - fail fast if not
        String apiKey = getConfigString("api_key", null);
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new IOException(MISSING_KEY);
        }

        int timeoutSeconds = getConfigInt("timeout_seconds", 60);
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    /**
     * Model used for text generation.
     */
    public String generationModel() {
        return getConfigString("model", DEFAULT_MODEL);
    }

    /**
     * Model used for embeddings.
     */
    public String embeddingModel() {
        return getConfigString("embedding_model", DEFAULT_EMBEDDING_MODEL);
    }

    /**
     * POST a JSON payload to {@code models/{model}:{method}} and return the response body.
     *
     * @throws IOException if the service answers with anything but 200
     */
    public String sendApiRequest(String model, String method, String payload)
            throws IOException, InterruptedException {
        String apiEndpoint = getConfigString("api_endpoint", DEFAULT_ENDPOINT);
        String apiKey = getConfigString("api_key", null);
        int timeoutSeconds = getConfigInt("timeout_seconds", 60);

        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new IllegalStateException(MISSING_KEY);
        }

        String url = apiEndpoint.replace("{model}", model).replace("{method}", method) + "?key=" + apiKey;

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();

        logger.debug("Calling Gemini {}:{} ({} bytes)", model, method, payload.length());
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException(
                    "API request failed with status: " + response.statusCode() + ", body: " + response.body());
        }

        return response.body();
    }

    /**
     * Gets a string configuration value with fallback to environment variables.
     */
    private String getConfigString(String key, String defaultValue) {
        Object value = config.get(key);
        if (value instanceof String str && !str.trim().isEmpty()) {
            return str;
        }
        return getEnvironmentFallback(key, defaultValue);
    }

    private String getEnvironmentFallback(String key, String defaultValue) {
        String envName = switch (key) {
            case "api_key" -> "GEMINI_API_KEY";
            case "api_endpoint" -> "AI_SERVICE_ENDPOINT";
            default -> null;
        };
        if (envName != null) {
            String envValue = System.getenv(envName);
            if (envValue != null && !envValue.trim().isEmpty()) {
                return envValue;
            }
        }
        return defaultValue;
    }

    private int getConfigInt(String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Integer i) {
            return i;
        } else if (value instanceof String str) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric ai_service.{}: {}", key, str);
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
