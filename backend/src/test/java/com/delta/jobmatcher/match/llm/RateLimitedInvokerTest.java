package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RateLimitedInvokerTest {
    private static final String MODEL = "gemini-2.0-flash";
    private static final LlmRequest REQUEST = new LlmRequest("system", "user");

    @Mock
    private LlmBackend backend;

    private FakeClock clock;
    private MatcherProperties properties;
    private RateLimitedInvoker invoker;

    @BeforeEach
    void setUp() {
        clock = new FakeClock(Instant.parse("2026-01-05T09:00:00Z"));
        properties = new MatcherProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setBaseDelayMs(2000);
        properties.getRetry().setMaxDelayMs(60000);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, clock, clock.sleeper());
        invoker = new RateLimitedInvoker(
            backend,
            limiter,
            new JsonPayloadExtractor(new ObjectMapper()),
            properties,
            clock.sleeper()
        );
    }

    @Test
    void returnsDecodedPayloadOnFirstSuccess() {
        when(backend.complete(MODEL, REQUEST)).thenReturn(LlmCallResult.success(MODEL, "{\"value\": 7}", Duration.ZERO));

        Integer value = invoker.invoke(MODEL, REQUEST, payload -> payload.get("value").asInt());

        assertThat(value).isEqualTo(7);
        assertThat(clock.sleeps()).isEmpty();
    }

    @Test
    void retriesQuotaErrorsWithExponentialBackoff() {
        when(backend.complete(MODEL, REQUEST)).thenReturn(
            LlmCallResult.rateLimited(MODEL, 429, "quota", null, Duration.ZERO),
            LlmCallResult.rateLimited(MODEL, 429, "quota", null, Duration.ZERO),
            LlmCallResult.success(MODEL, "```json\n{\"ok\": true}\n```", Duration.ZERO)
        );

        Boolean ok = invoker.invoke(MODEL, REQUEST, payload -> payload.get("ok").asBoolean());

        assertThat(ok).isTrue();
        assertThat(clock.sleeps()).containsExactly(Duration.ofMillis(2000), Duration.ofMillis(4000));
        verify(backend, times(3)).complete(MODEL, REQUEST);
    }

    @Test
    void honorsProviderAdvisedRetryDelay() {
        when(backend.complete(MODEL, REQUEST)).thenReturn(
            LlmCallResult.rateLimited(MODEL, 429, "quota", Duration.ofSeconds(17), Duration.ZERO),
            LlmCallResult.success(MODEL, "[]", Duration.ZERO)
        );

        invoker.invoke(MODEL, REQUEST, payload -> payload.size());

        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(17));
    }

    @Test
    void throwsQuotaExceededAfterMaxAttempts() {
        when(backend.complete(MODEL, REQUEST))
            .thenReturn(LlmCallResult.rateLimited(MODEL, 429, "Resource has been exhausted", null, Duration.ZERO));

        assertThatThrownBy(() -> invoker.invoke(MODEL, REQUEST, payload -> payload))
            .isInstanceOfSatisfying(QuotaExceededException.class, e -> {
                assertThat(e.attempts()).isEqualTo(3);
                assertThat(e.modelId()).isEqualTo(MODEL);
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.QUOTA_EXCEEDED);
            });
        verify(backend, times(3)).complete(MODEL, REQUEST);
        assertThat(clock.sleeps()).hasSize(2);
    }

    @Test
    void providerErrorsAreNotRetried() {
        when(backend.complete(MODEL, REQUEST))
            .thenReturn(LlmCallResult.failure(MODEL, 400, "http_4xx", "API key not valid", Duration.ZERO));

        assertThatThrownBy(() -> invoker.invoke(MODEL, REQUEST, payload -> payload))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.providerErrorCode()).isEqualTo("http_4xx");
                assertThat(e.getMessage()).contains("API key not valid");
            });
        verify(backend, times(1)).complete(MODEL, REQUEST);
        assertThat(clock.sleeps()).isEmpty();
    }

    @Test
    void backendExceptionMentioningQuotaIsRetried() {
        when(backend.complete(eq(MODEL), any(LlmRequest.class)))
            .thenThrow(new IllegalStateException("429 Too Many Requests"))
            .thenReturn(LlmCallResult.success(MODEL, "{}", Duration.ZERO));

        invoker.invoke(MODEL, REQUEST, payload -> payload);

        assertThat(clock.sleeps()).containsExactly(Duration.ofMillis(2000));
    }

    @Test
    void unparseableTextRaisesMalformedResponseWithRawText() {
        when(backend.complete(MODEL, REQUEST)).thenReturn(LlmCallResult.success(MODEL, "Sure! Here you go: {oops", Duration.ZERO));

        assertThatThrownBy(() -> invoker.invoke(MODEL, REQUEST, payload -> payload))
            .isInstanceOfSatisfying(MalformedResponseException.class, e -> {
                assertThat(e.rawText()).isEqualTo("Sure! Here you go: {oops");
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.MALFORMED_RESPONSE);
            });
    }

    @Test
    void readerRejectionBecomesMalformedResponse() {
        when(backend.complete(MODEL, REQUEST)).thenReturn(LlmCallResult.success(MODEL, "{\"unexpected\": 1}", Duration.ZERO));

        assertThatThrownBy(() -> invoker.invoke(MODEL, REQUEST, payload -> {
            throw new IllegalArgumentException("missing hard_skills");
        }))
            .isInstanceOfSatisfying(MalformedResponseException.class, e -> {
                assertThat(e.getMessage()).contains("missing hard_skills");
                assertThat(e.rawText()).isEqualTo("{\"unexpected\": 1}");
            });
    }

    @Test
    void backoffIsCappedByMaxDelay() {
        properties.getRetry().setMaxDelayMs(5000);
        LlmCallResult limited = LlmCallResult.rateLimited(MODEL, 429, "quota", null, Duration.ZERO);

        assertThat(invoker.retryDelay(limited, 1)).isEqualTo(Duration.ofMillis(2000));
        assertThat(invoker.retryDelay(limited, 2)).isEqualTo(Duration.ofMillis(4000));
        assertThat(invoker.retryDelay(limited, 3)).isEqualTo(Duration.ofMillis(5000));
    }
}
