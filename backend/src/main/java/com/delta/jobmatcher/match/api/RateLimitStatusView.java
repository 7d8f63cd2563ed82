package com.delta.jobmatcher.match.api;

public record RateLimitStatusView(
    String modelId,
    int recentCalls,
    int quota,
    long windowSeconds
) {
}
