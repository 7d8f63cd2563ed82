package com.delta.jobmatcher.match.service;

import com.delta.jobmatcher.match.model.ExtractedSkills;
import com.delta.jobmatcher.match.model.GapResult;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.PipelineMode;
import com.delta.jobmatcher.match.model.PipelineState;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.ReviewOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable state of one pipeline run, owned by a single orchestrator call.
 */
public final class PipelineRun {
    private final UUID runId;
    private final PipelineMode mode;
    private final Instant startedAt;
    private final List<PipelineState> stateTrail = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private List<Posting> postings = List.of();
    private Map<String, ExtractedSkills> skills = new LinkedHashMap<>();
    private List<Match> matches = List.of();
    private List<GapResult> gaps = List.of();
    private ReviewOutcome review = ReviewOutcome.empty();

    public PipelineRun(UUID runId, PipelineMode mode, Instant startedAt) {
        this.runId = runId;
        this.mode = mode;
        this.startedAt = startedAt;
    }

    public void enter(PipelineState state) {
        stateTrail.add(state);
    }

    public void warn(String warning) {
        if (warning != null && !warning.isBlank()) {
            warnings.add(warning);
        }
    }

    public UUID runId() {
        return runId;
    }

    public PipelineMode mode() {
        return mode;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public List<PipelineState> stateTrail() {
        return List.copyOf(stateTrail);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public List<Posting> postings() {
        return postings;
    }

    public void setPostings(List<Posting> postings) {
        this.postings = postings == null ? List.of() : List.copyOf(postings);
    }

    public Map<String, ExtractedSkills> skills() {
        return skills;
    }

    public void setSkills(Map<String, ExtractedSkills> skills) {
        this.skills = skills == null ? new LinkedHashMap<>() : new LinkedHashMap<>(skills);
    }

    public List<Match> matches() {
        return matches;
    }

    public void setMatches(List<Match> matches) {
        this.matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public List<GapResult> gaps() {
        return gaps;
    }

    public void setGaps(List<GapResult> gaps) {
        this.gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public ReviewOutcome review() {
        return review;
    }

    public void setReview(ReviewOutcome review) {
        this.review = review == null ? ReviewOutcome.empty() : review;
    }
}
