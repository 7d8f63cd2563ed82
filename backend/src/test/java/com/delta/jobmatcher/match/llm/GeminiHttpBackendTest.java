package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.config.MatcherProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiHttpBackendTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private FakeClock clock;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        clock = new FakeClock(Instant.parse("2026-01-05T09:00:00Z"));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void postsPromptAndReturnsCandidateText() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"{\\\"a\\\":\"},{\"text\":\"1}\"}]}}]}"));
        GeminiHttpBackend backend = backend("secret-key");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("be terse", "rank these"));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.text()).isEqualTo("{\"a\":1}");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1beta/models/gemini-2.0-flash:generateContent");
        assertThat(request.getHeader("x-goog-api-key")).isEqualTo("secret-key");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("systemInstruction").path("parts").path(0).path("text").asText()).isEqualTo("be terse");
        assertThat(body.path("contents").path(0).path("parts").path(0).path("text").asText()).isEqualTo("rank these");
        assertThat(body.path("generationConfig").path("responseMimeType").asText()).isEqualTo("application/json");
    }

    @Test
    void quotaErrorCarriesRetryInfoDelay() {
        server.enqueue(new MockResponse()
            .setResponseCode(429)
            .setBody("{\"error\":{\"code\":429,\"message\":\"Resource has been exhausted\",\"status\":\"RESOURCE_EXHAUSTED\","
                + "\"details\":[{\"@type\":\"type.googleapis.com/google.rpc.RetryInfo\",\"retryDelay\":\"21s\"}]}}"));
        GeminiHttpBackend backend = backend("k");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("s", "u"));

        assertThat(result.rateLimited()).isTrue();
        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofSeconds(21));
        assertThat(result.errorMessage()).isEqualTo("Resource has been exhausted");
    }

    @Test
    void quotaErrorFallsBackToRetryAfterHeader() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7").setBody("slow down"));
        GeminiHttpBackend backend = backend("k");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("s", "u"));

        assertThat(result.rateLimited()).isTrue();
        assertThat(result.retryAfter()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void serverErrorIsNonRetryableFailure() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"error\":{\"message\":\"overloaded\",\"status\":\"UNAVAILABLE\"}}"));
        GeminiHttpBackend backend = backend("k");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("s", "u"));

        assertThat(result.rateLimited()).isFalse();
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo("http_5xx");
        assertThat(result.errorMessage()).isEqualTo("overloaded");
    }

    @Test
    void blockedPromptHasNoCandidateText() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"));
        GeminiHttpBackend backend = backend("k");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("s", "u"));

        assertThat(result.errorCode()).isEqualTo("empty_candidate");
        assertThat(result.errorMessage()).contains("SAFETY");
    }

    @Test
    void missingApiKeyFailsWithoutCallingServer() {
        GeminiHttpBackend backend = backend(" ");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("s", "u"));

        assertThat(result.errorCode()).isEqualTo("missing_api_key");
        assertThat(result.duration()).isEqualTo(Duration.ZERO);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void callDurationComesFromInjectedClock() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"{}\"}]}}]}"));
        GeminiHttpBackend backend = backend("secret-key");

        LlmCallResult result = backend.complete("gemini-2.0-flash", new LlmRequest("s", "u"));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.duration()).isEqualTo(Duration.ZERO);
    }

    @Test
    void parsesFractionalSeconds() {
        assertThat(GeminiHttpBackend.parseSeconds("1.5s")).isEqualTo(Duration.ofMillis(1500));
        assertThat(GeminiHttpBackend.parseSeconds("abc")).isNull();
        assertThat(GeminiHttpBackend.parseSeconds("0")).isNull();
    }

    private GeminiHttpBackend backend(String apiKey) {
        MatcherProperties properties = new MatcherProperties();
        properties.getGemini().setApiKey(apiKey);
        properties.getGemini().setBaseUrl(server.url("/").toString());
        properties.getGemini().setRequestTimeoutSeconds(5);
        return new GeminiHttpBackend(properties, objectMapper, executor, clock);
    }
}
