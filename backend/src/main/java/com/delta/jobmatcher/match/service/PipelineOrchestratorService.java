package com.delta.jobmatcher.match.service;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.model.ExtractedSkills;
import com.delta.jobmatcher.match.model.FinalReport;
import com.delta.jobmatcher.match.model.GapResult;
import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.PipelineMode;
import com.delta.jobmatcher.match.model.PipelineState;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.QuickRankResult;
import com.delta.jobmatcher.match.model.ReviewOutcome;
import com.delta.jobmatcher.match.model.StageResult;
import com.delta.jobmatcher.match.stage.GapAnalysisStage;
import com.delta.jobmatcher.match.stage.PostingNormalizer;
import com.delta.jobmatcher.match.stage.RankingStage;
import com.delta.jobmatcher.match.stage.ReviewStage;
import com.delta.jobmatcher.match.stage.SkillExtractionStage;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives a run through its states. Every state runs in its own try/catch: item failures and
 * whole-stage failures become warnings on the report and the run always reaches
 * {@link PipelineState#FINALIZED}.
 */
@Service
public class PipelineOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);

    static final String NO_POSTINGS_WARNING = "No valid job postings after normalization";

    private final PostingNormalizer postingNormalizer;
    private final SkillExtractionStage skillExtractionStage;
    private final RankingStage rankingStage;
    private final GapAnalysisStage gapAnalysisStage;
    private final ReviewStage reviewStage;
    private final ReportAggregator reportAggregator;
    private final MatcherProperties properties;
    private final Clock clock;

    public PipelineOrchestratorService(
        PostingNormalizer postingNormalizer,
        SkillExtractionStage skillExtractionStage,
        RankingStage rankingStage,
        GapAnalysisStage gapAnalysisStage,
        ReviewStage reviewStage,
        ReportAggregator reportAggregator,
        MatcherProperties properties,
        Clock clock
    ) {
        this.postingNormalizer = postingNormalizer;
        this.skillExtractionStage = skillExtractionStage;
        this.rankingStage = rankingStage;
        this.gapAnalysisStage = gapAnalysisStage;
        this.reviewStage = reviewStage;
        this.reportAggregator = reportAggregator;
        this.properties = properties;
        this.clock = clock;
    }

    public FinalReport runFull(Profile profile, List<JsonNode> rawPostings, Integer topK) {
        PipelineRun run = new PipelineRun(UUID.randomUUID(), PipelineMode.FULL, clock.instant());
        int limit = topK == null ? properties.getRanking().getDefaultTopK() : Math.max(1, topK);
        log.info("Pipeline run {} started: {} raw postings, topK={}", run.runId(), size(rawPostings), limit);

        if (!normalize(run, rawPostings)) {
            return finish(run);
        }
        List<Posting> extracted = extractSkills(run, run.postings());

        List<Match> matches = runStage(
            run,
            PipelineState.RANKING,
            () -> rankingStage.fullRank(profile, extracted, run.skills(), limit),
            List.of()
        );
        run.setMatches(matches);

        List<Posting> ranked = matches.stream().map(Match::posting).toList();
        run.setGaps(runStage(
            run,
            PipelineState.ANALYZING_GAPS,
            () -> gapAnalysisStage.analyzeAll(profile, ranked, run.skills()),
            List.of()
        ));

        run.setReview(runStage(
            run,
            PipelineState.REVIEWING,
            () -> reviewStage.review(profile, run.matches(), run.gaps()),
            ReviewOutcome.empty()
        ));
        return finish(run);
    }

    /**
     * Gap analysis for one posting, no ranking. {@code postingId} null selects the first valid posting.
     */
    public FinalReport runSingleJob(Profile profile, List<JsonNode> rawPostings, String postingId) {
        PipelineRun run = new PipelineRun(UUID.randomUUID(), PipelineMode.SINGLE_JOB, clock.instant());
        log.info("Single-job run {} started: {} raw postings, postingId={}", run.runId(), size(rawPostings), postingId);

        if (!normalize(run, rawPostings)) {
            return finish(run);
        }
        Posting selected = select(run.postings(), postingId);
        if (selected == null) {
            log.warn("Run {}: posting {} not among {} valid postings", run.runId(), postingId, run.postings().size());
            run.warn("Posting " + postingId + " was not found among the valid postings");
            return finish(run);
        }
        List<Posting> extracted = extractSkills(run, List.of(selected));

        List<GapResult> gaps = runStage(
            run,
            PipelineState.ANALYZING_GAPS,
            () -> gapAnalysisStage.analyzeAll(profile, extracted, run.skills()),
            List.of()
        );
        run.setGaps(gaps);

        if (properties.getPipeline().isReviewSingleJob() && !gaps.isEmpty()) {
            List<Match> reviewed = List.of(new Match(selected, 1.0, "Selected by the user"));
            run.setReview(runStage(
                run,
                PipelineState.REVIEWING,
                () -> reviewStage.review(profile, reviewed, gaps),
                ReviewOutcome.empty()
            ));
        }
        return finish(run);
    }

    public QuickRankResult quickRank(Profile profile, List<JsonNode> rawPostings) {
        PipelineRun run = new PipelineRun(UUID.randomUUID(), PipelineMode.FULL, clock.instant());
        if (!normalize(run, rawPostings)) {
            return new QuickRankResult(Map.of(), run.warnings());
        }
        Map<String, Double> scores = runStage(
            run,
            PipelineState.RANKING,
            () -> rankingStage.quickRank(profile, run.postings()),
            Map.of()
        );
        log.info("Quick rank {} scored {} of {} postings", run.runId(), scores.size(), run.postings().size());
        return new QuickRankResult(scores, run.warnings());
    }

    private boolean normalize(PipelineRun run, List<JsonNode> rawPostings) {
        List<JsonNode> raw = rawPostings == null ? List.of() : rawPostings;
        run.setPostings(runStage(run, PipelineState.NORMALIZING, () -> postingNormalizer.normalize(raw), List.of()));
        if (run.postings().isEmpty()) {
            log.warn("Run {} has no valid postings after normalization", run.runId());
            run.warn(NO_POSTINGS_WARNING);
            return false;
        }
        return true;
    }

    /**
     * Extracts skills and returns the postings that may continue. A posting whose extraction
     * failed is dropped; when the whole stage fails every posting continues without skills.
     */
    private List<Posting> extractSkills(PipelineRun run, List<Posting> postings) {
        Set<String> failedIds = new HashSet<>();
        Map<String, ExtractedSkills> skills = runStage(
            run,
            PipelineState.EXTRACTING_SKILLS,
            () -> {
                StageResult<Map<String, ExtractedSkills>> result = skillExtractionStage.extract(postings);
                result.failures().forEach(failure -> failedIds.add(failure.itemId()));
                return result;
            },
            Map.of()
        );
        run.setSkills(skills);
        List<Posting> remaining = new ArrayList<>();
        for (Posting posting : postings) {
            if (!failedIds.contains(posting.id())) {
                remaining.add(posting);
            }
        }
        return remaining;
    }

    private <T> T runStage(PipelineRun run, PipelineState state, Supplier<StageResult<T>> stage, T fallback) {
        run.enter(state);
        Instant startedAt = clock.instant();
        log.info("Run {} entering {}", run.runId(), state);
        try {
            StageResult<T> result = stage.get();
            for (ItemFailure failure : result.failures()) {
                run.warn(itemWarning(state, failure));
            }
            log.info(
                "Run {} finished {} in {} ms with {} item failures",
                run.runId(),
                state,
                Duration.between(startedAt, clock.instant()).toMillis(),
                result.failures().size()
            );
            return result.output() == null ? fallback : result.output();
        } catch (RuntimeException e) {
            StageFailureException failure = new StageFailureException(state, e);
            log.warn("Run {}: {}", run.runId(), failure.getMessage(), e);
            run.warn(failure.getMessage());
            return fallback;
        }
    }

    private FinalReport finish(PipelineRun run) {
        run.enter(PipelineState.FINALIZED);
        FinalReport report = reportAggregator.aggregate(run, clock.instant());
        log.info(
            "Run {} finalized with status {}: ranked={}, gaps={}, warnings={}",
            run.runId(),
            report.status(),
            report.rankedJobs().size(),
            report.skillGaps().size(),
            report.warnings().size()
        );
        return report;
    }

    static String itemWarning(PipelineState state, ItemFailure failure) {
        String subject = failure.itemId() == null ? "an item" : "posting " + failure.itemId();
        String message = failure.message() == null || failure.message().isBlank() ? "" : ": " + failure.message();
        return state.label() + " failed for " + subject + " (" + failure.reasonCode() + ")" + message;
    }

    private static Posting select(List<Posting> postings, String postingId) {
        if (postingId == null || postingId.isBlank()) {
            return postings.get(0);
        }
        for (Posting posting : postings) {
            if (posting.id().equals(postingId.trim())) {
                return posting;
            }
        }
        return null;
    }

    private static int size(List<?> values) {
        return values == null ? 0 : values.size();
    }
}
