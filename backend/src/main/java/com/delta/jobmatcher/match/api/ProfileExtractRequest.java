package com.delta.jobmatcher.match.api;

public record ProfileExtractRequest(
    String resumeText
) {
}
