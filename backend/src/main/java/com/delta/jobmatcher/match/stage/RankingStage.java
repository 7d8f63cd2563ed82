package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.model.ExtractedSkills;
import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.StageResult;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.delta.jobmatcher.match.util.JsonNodes.firstText;
import static com.delta.jobmatcher.match.util.JsonNodes.number;
import static com.delta.jobmatcher.match.util.TextUtils.orDefault;
import static com.delta.jobmatcher.match.util.TextUtils.truncate;

/**
 * Scores postings against a profile.
 *
 * <ul>
 *   <li>{@link #quickRank}: one cheap call, id to score only, used to order fresh search results.</li>
 *   <li>{@link #fullRank}: one call with extracted skills, returns reasoned {@link Match}es.</li>
 * </ul>
 * Both use {@link ScoringRubric}. Scores the model returns for ids outside the batch are ignored.
 */
@Component
public class RankingStage {
    private static final Logger log = LoggerFactory.getLogger(RankingStage.class);

    static final String QUICK_SYSTEM_PROMPT = "You are a job matching expert. Rank jobs by how well they match the user's profile.\n"
        + ScoringRubric.TEXT + "\n"
        + "Return a JSON array of objects with job_id and match_score only. Return ONLY valid JSON.";

    static final String FULL_SYSTEM_PROMPT = "You are a job matching expert. Rank jobs by how well they match the user's profile.\n"
        + ScoringRubric.TEXT + "\n"
        + "Return a JSON array of objects, each with:\n"
        + "- job_id: the job id\n"
        + "- match_score: float between 0.0 and 1.0\n"
        + "- reasoning: one or two sentences explaining the score\n"
        + "Return ONLY valid JSON.";

    private final RateLimitedInvoker invoker;
    private final MatcherProperties properties;
    private final ProfileSummarizer profileSummarizer;
    private final ObjectMapper objectMapper;

    public RankingStage(
        RateLimitedInvoker invoker,
        MatcherProperties properties,
        ProfileSummarizer profileSummarizer,
        ObjectMapper objectMapper
    ) {
        this.invoker = invoker;
        this.properties = properties;
        this.profileSummarizer = profileSummarizer;
        this.objectMapper = objectMapper;
    }

    public StageResult<Map<String, Double>> quickRank(Profile profile, List<Posting> postings) {
        if (postings == null || postings.isEmpty()) {
            return StageResult.of(Map.of());
        }
        MatcherProperties.Ranking config = properties.getRanking();
        List<Posting> batch = postings.subList(0, Math.min(postings.size(), config.getQuickMaxPostings()));
        List<ItemFailure> failures = new ArrayList<>();
        for (Posting skipped : postings.subList(batch.size(), postings.size())) {
            failures.add(new ItemFailure(skipped.id(), ReasonCodeClassifier.NOT_SCORED, "Beyond the quick ranking batch size of " + batch.size()));
        }

        ArrayNode jobs = objectMapper.createArrayNode();
        for (Posting posting : batch) {
            ObjectNode job = jobs.addObject();
            job.put("id", posting.id());
            job.put("title", posting.title());
            job.put("company", orDefault(posting.company(), "Not specified"));
            job.put("description", truncate(posting.description(), config.getQuickDescriptionChars()));
        }
        String userPrompt = "User Profile:\n" + profileSummarizer.summarize(profile)
            + "\n\nJobs to Rank:\n" + toJson(jobs)
            + "\n\nReturn match scores for these jobs.";

        List<ScoredEntry> entries = invoker.invoke(
            properties.getModels().getRanking(),
            new LlmRequest(QUICK_SYSTEM_PROMPT, userPrompt),
            RankingStage::readScores
        );

        Map<String, ScoredEntry> byId = indexEntries(entries, batch, failures);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Posting posting : batch) {
            ScoredEntry entry = byId.get(posting.id());
            if (entry == null) {
                failures.add(new ItemFailure(posting.id(), ReasonCodeClassifier.NOT_SCORED, "Model returned no score"));
                continue;
            }
            scores.put(posting.id(), Match.clampScore(entry.score()));
        }
        log.info("Quick-ranked {} of {} postings", scores.size(), postings.size());
        return new StageResult<>(scores, failures);
    }

    public StageResult<List<Match>> fullRank(
        Profile profile,
        List<Posting> postings,
        Map<String, ExtractedSkills> skillsById,
        int topK
    ) {
        if (postings == null || postings.isEmpty()) {
            return StageResult.of(List.of());
        }
        MatcherProperties.Ranking config = properties.getRanking();
        Map<String, ExtractedSkills> skills = skillsById == null ? Map.of() : skillsById;
        List<Posting> considered = postings.subList(0, Math.min(postings.size(), config.getMaxPostings()));
        List<ItemFailure> failures = new ArrayList<>();
        for (Posting skipped : postings.subList(considered.size(), postings.size())) {
            failures.add(new ItemFailure(skipped.id(), ReasonCodeClassifier.NOT_SCORED, "Beyond the ranking cap of " + considered.size()));
        }

        ArrayNode jobs = objectMapper.createArrayNode();
        for (Posting posting : considered) {
            ObjectNode job = jobs.addObject();
            job.put("id", posting.id());
            job.put("title", posting.title());
            job.put("company", orDefault(posting.company(), "Not specified"));
            job.put("location", orDefault(posting.location(), "Not specified"));
            job.put("salary", orDefault(posting.salaryText(), "Not specified"));
            job.put("description", truncate(posting.description(), config.getDescriptionChars()));
            job.put("skills", skillsText(skills.get(posting.id()), config.getMaxSkillsPerCategory()));
        }
        String userPrompt = "User Profile:\n" + profileSummarizer.summarize(profile)
            + "\n\nJobs to Rank:\n" + toJson(jobs)
            + "\n\nRank these jobs and return match scores.";

        List<ScoredEntry> entries = invoker.invoke(
            properties.getModels().getRanking(),
            new LlmRequest(FULL_SYSTEM_PROMPT, userPrompt),
            RankingStage::readScores
        );

        Map<String, ScoredEntry> byId = indexEntries(entries, considered, failures);
        List<Match> matches = new ArrayList<>();
        for (Posting posting : considered) {
            ScoredEntry entry = byId.get(posting.id());
            if (entry == null) {
                failures.add(new ItemFailure(posting.id(), ReasonCodeClassifier.NOT_SCORED, "Model returned no score"));
                continue;
            }
            matches.add(new Match(posting, entry.score(), orDefault(entry.reasoning(), "No reasoning provided")));
        }
        List<Match> ranked = sortByScore(matches);
        int limit = Math.max(1, topK);
        if (ranked.size() > limit) {
            ranked = new ArrayList<>(ranked.subList(0, limit));
        }
        log.info("Ranked {} postings, keeping top {}", matches.size(), ranked.size());
        return new StageResult<>(ranked, failures);
    }

    /**
     * Sorts by score, highest first. {@link List#sort} is stable, so equal scores keep input order.
     */
    static List<Match> sortByScore(List<Match> matches) {
        List<Match> sorted = new ArrayList<>(matches);
        sorted.sort(Comparator.comparingDouble(Match::score).reversed());
        return sorted;
    }

    private Map<String, ScoredEntry> indexEntries(List<ScoredEntry> entries, List<Posting> batch, List<ItemFailure> failures) {
        Map<String, Posting> known = StageSupport.byId(batch);
        Map<String, ScoredEntry> byId = new LinkedHashMap<>();
        for (ScoredEntry entry : entries) {
            if (!known.containsKey(entry.postingId())) {
                log.warn("Ranking returned unknown posting id {}", entry.postingId());
                failures.add(new ItemFailure(entry.postingId(), ReasonCodeClassifier.UNKNOWN_POSTING_ID, "Model scored a posting that was not in the batch"));
                continue;
            }
            byId.putIfAbsent(entry.postingId(), entry);
        }
        return byId;
    }

    private String skillsText(ExtractedSkills skills, int maxPerCategory) {
        if (skills == null) {
            return "Not extracted";
        }
        return "Hard Skills: " + joinLimited(skills.hardSkills(), maxPerCategory)
            + "; Soft Skills: " + joinLimited(skills.softSkills(), maxPerCategory)
            + "; Tools: " + joinLimited(skills.tools(), maxPerCategory)
            + "; Seniority: " + orDefault(skills.seniority(), "Not specified");
    }

    private String joinLimited(Iterable<String> values, int limit) {
        List<String> out = new ArrayList<>();
        Iterator<String> iterator = values.iterator();
        while (iterator.hasNext() && out.size() < limit) {
            out.add(iterator.next());
        }
        return String.join(", ", out);
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ranking prompt", e);
        }
    }

    /**
     * Accepts a bare array, an object wrapping an array under {@code matches}, {@code scores},
     * {@code results} or {@code jobs}, or a flat {@code {"id": score}} object.
     */
    static List<ScoredEntry> readScores(JsonNode payload) {
        if (payload == null) {
            throw new IllegalArgumentException("missing ranking payload");
        }
        JsonNode array = payload;
        if (payload.isObject()) {
            for (String wrapper : List.of("matches", "scores", "results", "jobs", "rankings")) {
                JsonNode candidate = payload.get(wrapper);
                if (candidate != null && (candidate.isArray() || candidate.isObject())) {
                    array = candidate;
                    break;
                }
            }
        }
        List<ScoredEntry> entries = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode item : array) {
                String id = firstText(item, "job_id", "posting_id", "jobId", "postingId", "id");
                Double score = number(item, "match_score", "score", "matchScore");
                if (id == null || score == null) {
                    continue;
                }
                entries.add(new ScoredEntry(id, score, firstText(item, "reasoning", "reason", "explanation")));
            }
            return entries;
        }
        if (array.isObject()) {
            array.fields().forEachRemaining(field -> {
                JsonNode value = field.getValue();
                if (value.isNumber()) {
                    entries.add(new ScoredEntry(field.getKey(), value.asDouble(), null));
                }
            });
            if (entries.isEmpty() && array.size() > 0) {
                throw new IllegalArgumentException("object payload contains no numeric scores");
            }
            return entries;
        }
        throw new IllegalArgumentException("expected a JSON array of scored jobs");
    }

    record ScoredEntry(String postingId, double score, String reasoning) {
    }
}
