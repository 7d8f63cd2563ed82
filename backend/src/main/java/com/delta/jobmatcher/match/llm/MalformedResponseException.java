package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.match.util.ReasonCodeClassifier;

public class MalformedResponseException extends LlmInvocationException {
    private final String rawText;

    public MalformedResponseException(String modelId, String message, String rawText) {
        super(modelId, ReasonCodeClassifier.MALFORMED_RESPONSE, message);
        this.rawText = rawText;
    }

    public MalformedResponseException(String modelId, String message, String rawText, Throwable cause) {
        super(modelId, ReasonCodeClassifier.MALFORMED_RESPONSE, message, cause);
        this.rawText = rawText;
    }

    public String rawText() {
        return rawText;
    }
}
