package com.delta.jobmatcher.match.model;

public record ItemFailure(
    String itemId,
    String reasonCode,
    String message
) {
}
