package com.delta.jobmatcher.match.model;

public record Match(
    Posting posting,
    double score,
    String reasoning
) {
    public Match {
        score = clampScore(score);
    }

    public String postingId() {
        return posting == null ? null : posting.id();
    }

    public static double clampScore(double raw) {
        if (Double.isNaN(raw)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, raw));
    }
}
