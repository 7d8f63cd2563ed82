package com.delta.jobmatcher.match.model;

public record ReviewCorrection(
    String postingId,
    String issue,
    String suggestion
) {
}
