package com.delta.jobmatcher.match.model;

public enum PipelineState {
    NORMALIZING("normalize"),
    EXTRACTING_SKILLS("skill extraction"),
    RANKING("ranking"),
    ANALYZING_GAPS("gap analysis"),
    REVIEWING("review"),
    FINALIZED("finalize");

    private final String label;

    PipelineState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
