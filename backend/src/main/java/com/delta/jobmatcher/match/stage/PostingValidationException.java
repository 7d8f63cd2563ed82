package com.delta.jobmatcher.match.stage;

public class PostingValidationException extends RuntimeException {
    private final String itemRef;
    private final String reasonCode;

    public PostingValidationException(String itemRef, String reasonCode, String message) {
        super(message);
        this.itemRef = itemRef;
        this.reasonCode = reasonCode;
    }

    public String itemRef() {
        return itemRef;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
