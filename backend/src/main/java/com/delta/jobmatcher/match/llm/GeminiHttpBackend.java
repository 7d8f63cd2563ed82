package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * {@link LlmBackend} for the Gemini {@code generateContent} REST endpoint.
 */
@Service
public class GeminiHttpBackend implements LlmBackend {
    private static final Logger log = LoggerFactory.getLogger(GeminiHttpBackend.class);
    private static final String RETRY_INFO_TYPE = "type.googleapis.com/google.rpc.RetryInfo";

    private final MatcherProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Clock clock;

    public GeminiHttpBackend(
        MatcherProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("llmHttpExecutor") ExecutorService llmHttpExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getGemini().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(llmHttpExecutor)
            .build();
    }

    @Override
    public LlmCallResult complete(String modelId, LlmRequest request) {
        Instant startedAt = clock.instant();
        MatcherProperties.Gemini gemini = properties.getGemini();
        String apiKey = gemini.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return LlmCallResult.failure(modelId, 0, "missing_api_key", "Gemini API key is not configured", elapsed(startedAt));
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody(request, gemini.getTemperature()));
        } catch (JsonProcessingException e) {
            return LlmCallResult.failure(modelId, 0, "request_encoding", e.getOriginalMessage(), elapsed(startedAt));
        }

        URI uri = URI.create(gemini.getBaseUrl()
            + "/v1beta/models/"
            + URLEncoder.encode(modelId, StandardCharsets.UTF_8)
            + ":generateContent");
        HttpRequest httpRequest = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(gemini.getRequestTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("x-goog-api-key", apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        try {
            HttpResponse<String> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return toResult(modelId, response, startedAt);
        } catch (HttpTimeoutException e) {
            return LlmCallResult.failure(modelId, 0, "timeout", e.getMessage(), elapsed(startedAt));
        } catch (IOException e) {
            return LlmCallResult.failure(modelId, 0, "io_error", e.getMessage(), elapsed(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmCallResult.failure(modelId, 0, "interrupted", e.getMessage(), elapsed(startedAt));
        }
    }

    private ObjectNode requestBody(LlmRequest request, double temperature) {
        ObjectNode root = objectMapper.createObjectNode();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            root.putObject("systemInstruction")
                .putArray("parts")
                .addObject()
                .put("text", request.systemPrompt());
        }
        ArrayNode contents = root.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", request.userPrompt() == null ? "" : request.userPrompt());
        root.putObject("generationConfig")
            .put("temperature", temperature)
            .put("responseMimeType", "application/json");
        return root;
    }

    private LlmCallResult toResult(String modelId, HttpResponse<String> response, Instant startedAt) {
        int status = response.statusCode();
        String responseBody = response.body();
        JsonNode root = parseQuietly(responseBody);
        if (status >= 200 && status < 300) {
            String text = candidateText(root);
            if (text == null) {
                String reason = root == null ? null : root.path("promptFeedback").path("blockReason").asText(null);
                return LlmCallResult.failure(
                    modelId,
                    status,
                    "empty_candidate",
                    reason == null ? "Response contained no candidate text" : "Prompt blocked: " + reason,
                    elapsed(startedAt)
                );
            }
            return LlmCallResult.success(modelId, text, elapsed(startedAt));
        }

        JsonNode error = root == null ? null : root.path("error");
        String message = error == null || error.isMissingNode()
            ? responseBody
            : error.path("message").asText(responseBody);
        String providerStatus = error == null ? "" : error.path("status").asText("");
        if (status == 429 || "RESOURCE_EXHAUSTED".equalsIgnoreCase(providerStatus)) {
            Duration retryAfter = retryDelay(error);
            if (retryAfter == null) {
                retryAfter = retryAfterHeader(response);
            }
            log.debug("Gemini rate limited model {} (retryAfter={})", modelId, retryAfter);
            return LlmCallResult.rateLimited(modelId, status, message, retryAfter, elapsed(startedAt));
        }
        String errorCode = ReasonCodeClassifier.fromHttpStatus(status).toLowerCase(Locale.ROOT);
        return LlmCallResult.failure(modelId, status, errorCode, message, elapsed(startedAt));
    }

    private String candidateText(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            JsonNode value = part.get("text");
            if (value != null && value.isTextual()) {
                text.append(value.asText());
            }
        }
        return text.length() == 0 ? null : text.toString();
    }

    Duration retryDelay(JsonNode error) {
        if (error == null || !error.path("details").isArray()) {
            return null;
        }
        for (JsonNode detail : error.path("details")) {
            if (!RETRY_INFO_TYPE.equals(detail.path("@type").asText())) {
                continue;
            }
            return parseSeconds(detail.path("retryDelay").asText(null));
        }
        return null;
    }

    private Duration retryAfterHeader(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After").map(GeminiHttpBackend::parseSeconds).orElse(null);
    }

    static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        try {
            double seconds = Double.parseDouble(trimmed);
            if (seconds <= 0) {
                return null;
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private JsonNode parseQuietly(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Gemini response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Duration elapsed(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }
}
