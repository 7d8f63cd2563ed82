package com.delta.jobmatcher.match.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public record FinalReport(
    UUID runId,
    PipelineMode mode,
    String status,
    Instant startedAt,
    Instant finishedAt,
    List<Match> rankedJobs,
    List<GapResult> skillGaps,
    List<LearningResource> roadmap,
    List<String> upskillingSteps,
    String overallSummary,
    List<String> warnings,
    Set<String> flaggedPostingIds,
    List<ReviewCorrection> corrections,
    List<PipelineState> stateTrail
) {
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_WARNINGS = "COMPLETED_WITH_WARNINGS";
    public static final String STATUS_NO_POSTINGS = "NO_POSTINGS";

    public FinalReport {
        rankedJobs = rankedJobs == null ? List.of() : List.copyOf(rankedJobs);
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
        roadmap = roadmap == null ? List.of() : List.copyOf(roadmap);
        upskillingSteps = upskillingSteps == null ? List.of() : List.copyOf(upskillingSteps);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        flaggedPostingIds = flaggedPostingIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(flaggedPostingIds));
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        stateTrail = stateTrail == null ? List.of() : List.copyOf(stateTrail);
    }

    public PipelineState finalState() {
        return stateTrail.isEmpty() ? null : stateTrail.get(stateTrail.size() - 1);
    }
}
