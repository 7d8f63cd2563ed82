package com.delta.jobmatcher.match.llm;

public class LlmInvocationException extends RuntimeException {
    private final String modelId;
    private final String reasonCode;

    public LlmInvocationException(String modelId, String reasonCode, String message) {
        super(message);
        this.modelId = modelId;
        this.reasonCode = reasonCode;
    }

    public LlmInvocationException(String modelId, String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.modelId = modelId;
        this.reasonCode = reasonCode;
    }

    public String modelId() {
        return modelId;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
