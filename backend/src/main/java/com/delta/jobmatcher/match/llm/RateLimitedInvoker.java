package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Single entry point for model calls: rate limiting, retries on quota errors, payload decoding
 * and validation. Stages never talk to {@link LlmBackend} directly.
 */
@Service
public class RateLimitedInvoker {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedInvoker.class);

    private final LlmBackend backend;
    private final SlidingWindowRateLimiter rateLimiter;
    private final JsonPayloadExtractor payloadExtractor;
    private final MatcherProperties properties;
    private final Sleeper sleeper;

    public RateLimitedInvoker(
        LlmBackend backend,
        SlidingWindowRateLimiter rateLimiter,
        JsonPayloadExtractor payloadExtractor,
        MatcherProperties properties,
        Sleeper sleeper
    ) {
        this.backend = backend;
        this.rateLimiter = rateLimiter;
        this.payloadExtractor = payloadExtractor;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public <T> T invoke(String modelId, LlmRequest request, PayloadReader<T> reader) {
        LlmCallResult result = callWithRetry(modelId, request);
        JsonNode payload = payloadExtractor.extract(modelId, result.text());
        try {
            return reader.read(payload);
        } catch (MalformedResponseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedResponseException(
                modelId,
                "Response from model " + modelId + " failed validation: " + e.getMessage(),
                result.text(),
                e
            );
        }
    }

    LlmCallResult callWithRetry(String modelId, LlmRequest request) {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        LlmCallResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            rateLimiter.acquire(modelId);
            lastResult = callOnce(modelId, request);
            if (lastResult.isSuccessful()) {
                return lastResult;
            }
            if (!lastResult.rateLimited()) {
                throw new ProviderException(
                    modelId,
                    lastResult.errorCode(),
                    "Model " + modelId + " call failed (" + lastResult.errorCode() + "): " + lastResult.errorMessage()
                );
            }
            if (attempt >= maxAttempts) {
                break;
            }
            Duration delay = retryDelay(lastResult, attempt);
            log.warn(
                "Model {} rate limited on attempt {}/{}, retrying in {} ms",
                modelId,
                attempt,
                maxAttempts,
                delay.toMillis()
            );
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(modelId, "interrupted", "Interrupted while backing off from a quota error", e);
            }
        }
        throw new QuotaExceededException(modelId, maxAttempts, lastResult == null ? null : lastResult.errorMessage());
    }

    private LlmCallResult callOnce(String modelId, LlmRequest request) {
        LlmCallResult result;
        try {
            result = backend.complete(modelId, request);
        } catch (RuntimeException e) {
            if (ReasonCodeClassifier.looksLikeQuotaError(e.getMessage())) {
                return LlmCallResult.rateLimited(modelId, 0, e.getMessage(), null, Duration.ZERO);
            }
            throw new ProviderException(modelId, "backend_exception", "Model " + modelId + " call failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new ProviderException(modelId, "no_result", "Model " + modelId + " returned no result");
        }
        return result;
    }

    Duration retryDelay(LlmCallResult result, int attempt) {
        Duration advised = result.retryAfter();
        if (advised != null && !advised.isNegative() && !advised.isZero()) {
            return advised;
        }
        long baseDelayMs = properties.getRetry().getBaseDelayMs();
        long delay = baseDelayMs * (1L << Math.max(0, attempt - 1));
        int maxDelayMs = properties.getRetry().getMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return Duration.ofMillis(Math.max(0, delay));
    }
}
