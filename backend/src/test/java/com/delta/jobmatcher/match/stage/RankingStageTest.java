package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.PayloadReader;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.model.ExtractedSkills;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.StageResult;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.delta.jobmatcher.match.stage.SkillExtractionStageTest.postings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RankingStageTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private RateLimitedInvoker invoker;

    private MatcherProperties properties;
    private RankingStage stage;
    private final Profile profile = new Profile("Ana", "Backend developer", null, List.of("Java", "SQL"), List.of(), List.of(), null);

    @BeforeEach
    void setUp() {
        properties = new MatcherProperties();
        stage = new RankingStage(invoker, properties, new ProfileSummarizer(), objectMapper);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fullRankSortsDescendingAndKeepsInputOrderOnTies() {
        stubPayload("""
            [
              {"job_id": "P1", "match_score": 0.6, "reasoning": "ok"},
              {"job_id": "P2", "match_score": 0.9, "reasoning": "great"},
              {"job_id": "P3", "match_score": 0.6, "reasoning": "ok too"},
              {"job_id": "P4", "match_score": 0.2}
            ]
            """);

        StageResult<List<Match>> result = stage.fullRank(profile, postings("P1", "P2", "P3", "P4"), Map.of(), 10);

        assertThat(result.output()).extracting(Match::postingId).containsExactly("P2", "P1", "P3", "P4");
        assertThat(result.output().get(3).reasoning()).isEqualTo("No reasoning provided");
        assertThat(result.failures()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void fullRankClampsScoresAndTruncatesToTopK() {
        stubPayload("""
            {"matches": [
              {"posting_id": "P1", "score": 1.7, "reasoning": "too high"},
              {"posting_id": "P2", "score": -0.3, "reasoning": "too low"},
              {"posting_id": "P3", "score": "0.5", "reasoning": "string score"}
            ]}
            """);

        StageResult<List<Match>> result = stage.fullRank(profile, postings("P1", "P2", "P3"), Map.of(), 2);

        assertThat(result.output()).extracting(Match::score).containsExactly(1.0, 0.5);
        assertThat(result.output()).extracting(Match::postingId).containsExactly("P1", "P3");
    }

    @Test
    @SuppressWarnings("unchecked")
    void fullRankRecordsMissingAndUnknownIds() {
        stubPayload("[{\"job_id\": \"P1\", \"match_score\": 0.8}, {\"job_id\": \"GHOST\", \"match_score\": 0.99}]");

        StageResult<List<Match>> result = stage.fullRank(profile, postings("P1", "P2"), Map.of(), 10);

        assertThat(result.output()).extracting(Match::postingId).containsExactly("P1");
        assertThat(result.failures()).extracting(failure -> failure.itemId() + ":" + failure.reasonCode())
            .containsExactlyInAnyOrder(
                "GHOST:" + ReasonCodeClassifier.UNKNOWN_POSTING_ID,
                "P2:" + ReasonCodeClassifier.NOT_SCORED
            );
    }

    @Test
    @SuppressWarnings("unchecked")
    void fullRankPromptCarriesExtractedSkillsAndTruncatedDescriptions() {
        properties.getRanking().setDescriptionChars(10);
        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        when(invoker.invoke(anyString(), request.capture(), any(PayloadReader.class))).thenReturn(List.of());
        Posting posting = new Posting("P1", "Engineer", "Acme", null, null, null, "abcdefghijKLMNOP", null);
        ExtractedSkills skills = new ExtractedSkills("P1", Set.of("Kubernetes"), Set.of(), Set.of("Helm"), "senior");

        stage.fullRank(profile, List.of(posting), Map.of("P1", skills), 10);

        String prompt = request.getValue().userPrompt();
        assertThat(prompt).contains("abcdefghij").doesNotContain("KLMNOP");
        assertThat(prompt).contains("Kubernetes").contains("Helm").contains("Skills: Java, SQL");
        assertThat(request.getValue().systemPrompt()).contains(ScoringRubric.TEXT);
    }

    @Test
    @SuppressWarnings("unchecked")
    void quickRankReturnsScoresInPostingOrder() {
        stubPayload("{\"P3\": 0.4, \"P1\": 1.4, \"P2\": 0.7}");

        StageResult<Map<String, Double>> result = stage.quickRank(profile, postings("P1", "P2", "P3"));

        assertThat(result.output()).containsExactly(Map.entry("P1", 1.0), Map.entry("P2", 0.7), Map.entry("P3", 0.4));
    }

    @Test
    @SuppressWarnings("unchecked")
    void quickRankCapsBatchAndReportsSkippedPostings() {
        properties.getRanking().setQuickMaxPostings(2);
        stubPayload("[{\"job_id\": \"P1\", \"match_score\": 0.3}, {\"job_id\": \"P2\", \"match_score\": 0.6}]");

        StageResult<Map<String, Double>> result = stage.quickRank(profile, postings("P1", "P2", "P3"));

        assertThat(result.output()).containsOnlyKeys("P1", "P2");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.itemId()).isEqualTo("P3");
            assertThat(failure.reasonCode()).isEqualTo(ReasonCodeClassifier.NOT_SCORED);
        });
    }

    @Test
    void emptyInputMakesNoCall() {
        assertThat(stage.quickRank(profile, List.of()).output()).isEmpty();
        assertThat(stage.fullRank(profile, List.of(), Map.of(), 10).output()).isEmpty();
        verifyNoInteractions(invoker);
    }

    @Test
    void readScoresRejectsScalarPayload() throws Exception {
        assertThatThrownBy(() -> RankingStage.readScores(objectMapper.readTree("42")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @SuppressWarnings("unchecked")
    private void stubPayload(String json) {
        when(invoker.invoke(anyString(), any(LlmRequest.class), any(PayloadReader.class))).thenAnswer(invocation -> {
            PayloadReader<Object> reader = invocation.getArgument(2);
            return reader.read(objectMapper.readTree(json));
        });
    }
}
