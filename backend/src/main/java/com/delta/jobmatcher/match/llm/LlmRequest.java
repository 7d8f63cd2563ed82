package com.delta.jobmatcher.match.llm;

public record LlmRequest(
    String systemPrompt,
    String userPrompt
) {
}
