package com.delta.jobmatcher.match.service;

import com.delta.jobmatcher.match.model.PipelineState;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;

/**
 * A whole pipeline stage failed. The run continues with the stage's empty output.
 */
public class StageFailureException extends RuntimeException {
    private final PipelineState state;

    public StageFailureException(PipelineState state, Throwable cause) {
        super(state.label() + " stage failed: " + describe(cause), cause);
        this.state = state;
    }

    public PipelineState state() {
        return state;
    }

    public String reasonCode() {
        return ReasonCodeClassifier.STAGE_FAILED;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
