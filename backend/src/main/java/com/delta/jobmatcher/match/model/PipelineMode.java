package com.delta.jobmatcher.match.model;

public enum PipelineMode {
    FULL,
    SINGLE_JOB
}
