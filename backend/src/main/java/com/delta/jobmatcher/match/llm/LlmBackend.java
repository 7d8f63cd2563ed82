package com.delta.jobmatcher.match.llm;

/**
 * A chat-completion provider. Implementations report quota errors through
 * {@link LlmCallResult#rateLimited()} instead of throwing, so callers can decide on retries.
 */
public interface LlmBackend {

    LlmCallResult complete(String modelId, LlmRequest request);
}
