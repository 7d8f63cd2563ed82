package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.match.util.ReasonCodeClassifier;

public class ProviderException extends LlmInvocationException {
    private final String providerErrorCode;

    public ProviderException(String modelId, String providerErrorCode, String message) {
        super(modelId, ReasonCodeClassifier.PROVIDER_ERROR, message);
        this.providerErrorCode = providerErrorCode;
    }

    public ProviderException(String modelId, String providerErrorCode, String message, Throwable cause) {
        super(modelId, ReasonCodeClassifier.PROVIDER_ERROR, message, cause);
        this.providerErrorCode = providerErrorCode;
    }

    public String providerErrorCode() {
        return providerErrorCode;
    }
}
