package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.match.util.ReasonCodeClassifier;

public class QuotaExceededException extends LlmInvocationException {
    private final int attempts;

    public QuotaExceededException(String modelId, int attempts, String providerMessage) {
        super(
            modelId,
            ReasonCodeClassifier.QUOTA_EXCEEDED,
            "Quota exceeded for model " + modelId + " after " + attempts + " attempt(s)"
                + (providerMessage == null || providerMessage.isBlank() ? "" : ": " + providerMessage)
        );
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
