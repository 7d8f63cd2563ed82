package com.delta.jobmatcher.match.service;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.FakeClock;
import com.delta.jobmatcher.match.llm.JsonPayloadExtractor;
import com.delta.jobmatcher.match.llm.LlmBackend;
import com.delta.jobmatcher.match.llm.LlmCallResult;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.llm.SlidingWindowRateLimiter;
import com.delta.jobmatcher.match.model.FinalReport;
import com.delta.jobmatcher.match.model.GapResult;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.PipelineState;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.QuickRankResult;
import com.delta.jobmatcher.match.stage.GapAnalysisStage;
import com.delta.jobmatcher.match.stage.PostingNormalizer;
import com.delta.jobmatcher.match.stage.ProfileSummarizer;
import com.delta.jobmatcher.match.stage.RankingStage;
import com.delta.jobmatcher.match.stage.ReviewStage;
import com.delta.jobmatcher.match.stage.SkillExtractionStage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineOrchestratorServiceTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Profile profile = new Profile("Ana", "Backend developer", null, List.of("Java", "SQL"), List.of(), List.of(), null);

    private ScriptedBackend backend;
    private MatcherProperties properties;
    private PipelineOrchestratorService service;

    @BeforeEach
    void setUp() {
        backend = new ScriptedBackend();
        properties = new MatcherProperties();
        FakeClock clock = new FakeClock(Instant.parse("2026-01-05T09:00:00Z"));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, clock, clock.sleeper());
        RateLimitedInvoker invoker = new RateLimitedInvoker(
            backend,
            limiter,
            new JsonPayloadExtractor(objectMapper),
            properties,
            clock.sleeper()
        );
        service = new PipelineOrchestratorService(
            new PostingNormalizer(),
            new SkillExtractionStage(invoker, properties, clock.sleeper()),
            new RankingStage(invoker, properties, new ProfileSummarizer(), objectMapper),
            new GapAnalysisStage(invoker, properties, clock.sleeper()),
            new ReviewStage(invoker, properties, objectMapper),
            new ReportAggregator(properties),
            properties,
            clock
        );
    }

    @Test
    void zeroPostingsFinalizesWithEmptyReportAndNoModelCalls() {
        FinalReport report = service.runFull(profile, List.of(), null);

        assertThat(report.status()).isEqualTo(FinalReport.STATUS_NO_POSTINGS);
        assertThat(report.stateTrail()).containsExactly(PipelineState.NORMALIZING, PipelineState.FINALIZED);
        assertThat(report.finalState()).isEqualTo(PipelineState.FINALIZED);
        assertThat(report.rankedJobs()).isEmpty();
        assertThat(report.skillGaps()).isEmpty();
        assertThat(report.roadmap()).isEmpty();
        assertThat(report.warnings()).containsExactly(PipelineOrchestratorService.NO_POSTINGS_WARNING);
        assertThat(backend.calls).isEmpty();
    }

    @Test
    void invalidRecordsOnlyStillFinalize() {
        FinalReport report = service.runFull(profile, List.of(objectMapper.createObjectNode().put("title", "No id")), 5);

        assertThat(report.status()).isEqualTo(FinalReport.STATUS_NO_POSTINGS);
        assertThat(report.finalState()).isEqualTo(PipelineState.FINALIZED);
        assertThat(report.warnings()).contains(PipelineOrchestratorService.NO_POSTINGS_WARNING);
        assertThat(report.warnings()).anySatisfy(warning -> assertThat(warning).contains("raw[0]"));
        assertThat(backend.calls).isEmpty();
    }

    @Test
    void malformedExtractionDropsPostingFromLaterStages() {
        backend.malformedExtractionFor.add("P2");

        FinalReport report = service.runFull(profile, postings("P1", "P2", "P3"), null);

        assertThat(report.stateTrail()).containsExactly(
            PipelineState.NORMALIZING,
            PipelineState.EXTRACTING_SKILLS,
            PipelineState.RANKING,
            PipelineState.ANALYZING_GAPS,
            PipelineState.REVIEWING,
            PipelineState.FINALIZED
        );
        assertThat(report.rankedJobs()).extracting(Match::postingId).containsExactly("P3", "P1");
        assertThat(report.skillGaps()).extracting(GapResult::postingId).containsExactly("P3", "P1");
        assertThat(report.warnings()).anySatisfy(warning -> assertThat(warning)
            .contains("skill extraction")
            .contains("P2")
            .contains("MALFORMED_RESPONSE"));
        assertThat(report.status()).isEqualTo(FinalReport.STATUS_COMPLETED_WITH_WARNINGS);
        assertThat(report.roadmap()).extracting(resource -> resource.name()).containsExactly("Kafka 101", "Course P3", "Course P1");
        assertThat(report.flaggedPostingIds()).containsExactly("P1");
    }

    @Test
    void cleanRunCompletesWithoutWarnings() {
        FinalReport report = service.runFull(profile, postings("P1", "P2"), 1);

        assertThat(report.status()).isEqualTo(FinalReport.STATUS_COMPLETED);
        assertThat(report.warnings()).isEmpty();
        assertThat(report.rankedJobs()).extracting(Match::postingId).containsExactly("P2");
        assertThat(report.overallSummary()).startsWith("Ranked 1 job out of 2 postings.");
    }

    @Test
    void rankingFailureBecomesWarningAndRunContinues() {
        backend.failRanking = true;

        FinalReport report = service.runFull(profile, postings("P1", "P2"), null);

        assertThat(report.finalState()).isEqualTo(PipelineState.FINALIZED);
        assertThat(report.stateTrail()).contains(PipelineState.ANALYZING_GAPS, PipelineState.REVIEWING);
        assertThat(report.rankedJobs()).isEmpty();
        assertThat(report.skillGaps()).isEmpty();
        assertThat(report.warnings()).anySatisfy(warning -> assertThat(warning).startsWith("ranking stage failed: "));
        assertThat(backend.callsOfKind("review")).isZero();
    }

    @Test
    void singleJobAnalyzesSelectedPostingWithoutRanking() {
        FinalReport report = service.runSingleJob(profile, postings("P1", "P2", "P3"), "P2");

        assertThat(report.stateTrail()).containsExactly(
            PipelineState.NORMALIZING,
            PipelineState.EXTRACTING_SKILLS,
            PipelineState.ANALYZING_GAPS,
            PipelineState.FINALIZED
        );
        assertThat(report.rankedJobs()).isEmpty();
        assertThat(report.skillGaps()).extracting(GapResult::postingId).containsExactly("P2");
        assertThat(backend.callsOfKind("extraction")).isEqualTo(1);
        assertThat(backend.callsOfKind("ranking")).isZero();
        assertThat(backend.callsOfKind("review")).isZero();
    }

    @Test
    void singleJobDefaultsToFirstPostingAndCanBeReviewed() {
        properties.getPipeline().setReviewSingleJob(true);

        FinalReport report = service.runSingleJob(profile, postings("P1", "P2"), null);

        assertThat(report.skillGaps()).extracting(GapResult::postingId).containsExactly("P1");
        assertThat(report.stateTrail()).contains(PipelineState.REVIEWING);
        assertThat(backend.callsOfKind("review")).isEqualTo(1);
    }

    @Test
    void singleJobWithUnknownIdFinalizesWithWarning() {
        FinalReport report = service.runSingleJob(profile, postings("P1"), "P9");

        assertThat(report.finalState()).isEqualTo(PipelineState.FINALIZED);
        assertThat(report.skillGaps()).isEmpty();
        assertThat(report.warnings()).anySatisfy(warning -> assertThat(warning).contains("P9"));
        assertThat(backend.calls).isEmpty();
    }

    @Test
    void quickRankScoresNormalizedPostings() {
        QuickRankResult result = service.quickRank(profile, postings("P1", "P2", "P3"));

        assertThat(result.scores()).containsOnlyKeys("P1", "P2", "P3");
        assertThat(result.scores().get("P3")).isEqualTo(0.3);
        assertThat(result.warnings()).isEmpty();
        assertThat(backend.calls).hasSize(1);
    }

    @Test
    void quickRankWithoutPostingsMakesNoCall() {
        QuickRankResult result = service.quickRank(profile, null);

        assertThat(result.scores()).isEqualTo(Map.of());
        assertThat(result.warnings()).containsExactly(PipelineOrchestratorService.NO_POSTINGS_WARNING);
        assertThat(backend.calls).isEmpty();
    }

    private List<JsonNode> postings(String... ids) {
        List<JsonNode> postings = new ArrayList<>();
        for (String id : ids) {
            postings.add(objectMapper.createObjectNode()
                .put("id", id)
                .put("title", "Role " + id)
                .put("company", "Company " + id)
                .put("description", "Work on " + id + " systems."));
        }
        return postings;
    }

    /**
     * Answers each prompt by its kind. Scores grow with the posting number.
     */
    private static class ScriptedBackend implements LlmBackend {
        private final List<String> calls = new ArrayList<>();
        private final Set<String> malformedExtractionFor = new HashSet<>();
        private boolean failRanking;

        @Override
        public LlmCallResult complete(String modelId, LlmRequest request) {
            String system = request.systemPrompt();
            String user = request.userPrompt();
            if (system.contains("Extract structured skills")) {
                calls.add("extraction");
                for (String id : malformedExtractionFor) {
                    if (user.contains("Job Title: Role " + id + "\n")) {
                        return LlmCallResult.success(modelId, "I could not parse this posting, sorry.", Duration.ZERO);
                    }
                }
                return LlmCallResult.success(modelId, "{\"hard_skills\":[\"Java\"],\"soft_skills\":[],\"tools\":[\"Git\"]}", Duration.ZERO);
            }
            if (system.contains("Rank jobs")) {
                calls.add("ranking");
                if (failRanking) {
                    return LlmCallResult.failure(modelId, 500, "http_5xx", "internal error", Duration.ZERO);
                }
                StringJoiner entries = new StringJoiner(",", "[", "]");
                for (int n = 1; n <= 9; n++) {
                    if (user.contains("\"id\" : \"P" + n + "\"")) {
                        entries.add("{\"job_id\":\"P" + n + "\",\"match_score\":" + (n / 10.0) + ",\"reasoning\":\"r" + n + "\"}");
                    }
                }
                return LlmCallResult.success(modelId, entries.toString(), Duration.ZERO);
            }
            if (system.contains("skill gap analyst")) {
                calls.add("gap");
                String id = user.substring(user.indexOf("Job Title: Role ") + "Job Title: Role ".length(), user.indexOf('\n', user.indexOf("Job Title: Role ")));
                return LlmCallResult.success(modelId, "{\"matched_skills\":[\"Java\"],\"missing_required_skills\":[\"Kafka\"],"
                    + "\"suggested_learning_path\":[\"Learn Kafka\"],"
                    + "\"learning_resources\":[{\"name\":\"Kafka 101\",\"url\":\"https://example.com/kafka\"},"
                    + "{\"name\":\"Course " + id + "\",\"url\":\"https://example.com/" + id + "\"}]}", Duration.ZERO);
            }
            if (system.contains("quality assurance")) {
                calls.add("review");
                return LlmCallResult.success(modelId, "{\"warnings\":[],\"flagged_job_ids\":[\"P1\"],\"corrections\":[]}", Duration.ZERO);
            }
            return LlmCallResult.failure(modelId, 400, "http_4xx", "unexpected prompt", Duration.ZERO);
        }

        long callsOfKind(String kind) {
            return calls.stream().filter(kind::equals).count();
        }
    }
}
