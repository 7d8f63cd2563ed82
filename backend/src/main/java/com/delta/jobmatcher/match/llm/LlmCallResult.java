package com.delta.jobmatcher.match.llm;

import java.time.Duration;

/**
 * Outcome of one backend call. Exactly one of {@code text} or {@code errorCode} is meaningful.
 */
public record LlmCallResult(
    String modelId,
    String text,
    int statusCode,
    boolean rateLimited,
    String errorCode,
    String errorMessage,
    Duration retryAfter,
    Duration duration
) {
    public static LlmCallResult success(String modelId, String text, Duration duration) {
        return new LlmCallResult(modelId, text, 200, false, null, null, null, duration);
    }

    public static LlmCallResult rateLimited(
        String modelId,
        int statusCode,
        String message,
        Duration retryAfter,
        Duration duration
    ) {
        return new LlmCallResult(modelId, null, statusCode, true, "rate_limited", message, retryAfter, duration);
    }

    public static LlmCallResult failure(
        String modelId,
        int statusCode,
        String errorCode,
        String message,
        Duration duration
    ) {
        return new LlmCallResult(modelId, null, statusCode, false, errorCode, message, null, duration);
    }

    public boolean isSuccessful() {
        return errorCode == null && !rateLimited;
    }
}
