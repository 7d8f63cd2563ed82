package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.model.GapResult;
import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.Preferences;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.ReviewCorrection;
import com.delta.jobmatcher.match.model.ReviewOutcome;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.delta.jobmatcher.match.util.JsonNodes.firstPresent;
import static com.delta.jobmatcher.match.util.JsonNodes.firstText;
import static com.delta.jobmatcher.match.util.JsonNodes.stringList;
import static com.delta.jobmatcher.match.util.TextUtils.joinOrDefault;
import static com.delta.jobmatcher.match.util.TextUtils.orDefault;

/**
 * Quality check over the ranked matches and their gaps: irrelevant jobs, hallucinated skills,
 * and experience, location or salary mismatches against the profile.
 */
@Component
public class ReviewStage {
    private static final Logger log = LoggerFactory.getLogger(ReviewStage.class);

    static final String SYSTEM_PROMPT = """
        You are a quality assurance reviewer for job recommendations. Identify:
        1. Obviously irrelevant jobs for this user
        2. Hallucinated skills: matched skills that do not appear in the user profile
        3. Inconsistencies such as a high score despite an experience level, location or salary mismatch
        Return a JSON object with:
        - warnings: list of warning messages describing the issues found
        - flagged_job_ids: list of job ids that should be flagged for review
        - corrections: list of objects with job_id, issue and suggestion
        Be thorough but fair. Return ONLY valid JSON.""";

    private final RateLimitedInvoker invoker;
    private final MatcherProperties properties;
    private final ObjectMapper objectMapper;

    public ReviewStage(RateLimitedInvoker invoker, MatcherProperties properties, ObjectMapper objectMapper) {
        this.invoker = invoker;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public StageResult<ReviewOutcome> review(Profile profile, List<Match> matches, List<GapResult> gaps) {
        if (matches == null || matches.isEmpty()) {
            return StageResult.of(ReviewOutcome.empty());
        }
        MatcherProperties.Review config = properties.getReview();
        List<Match> reviewed = matches.subList(0, Math.min(matches.size(), config.getMaxMatches()));
        Map<String, GapResult> gapsById = gaps == null
            ? Map.of()
            : gaps.stream().collect(Collectors.toMap(GapResult::postingId, Function.identity(), (first, ignored) -> first));

        ArrayNode summary = objectMapper.createArrayNode();
        for (Match match : reviewed) {
            Posting posting = match.posting();
            GapResult gap = gapsById.get(posting.id());
            ObjectNode entry = summary.addObject();
            entry.put("job_id", posting.id());
            entry.put("title", posting.title());
            entry.put("company", orDefault(posting.company(), "Not specified"));
            entry.put("location", orDefault(posting.location(), "Not specified"));
            entry.put("salary", orDefault(posting.salaryText(), "Not specified"));
            entry.put("match_score", match.score());
            ArrayNode matched = entry.putArray("matched_skills");
            ArrayNode missing = entry.putArray("missing_skills");
            if (gap != null) {
                gap.matchedSkills().stream().limit(config.getMaxSkillsPerMatch()).forEach(matched::add);
                gap.missingRequiredSkills().stream().limit(config.getMaxSkillsPerMatch()).forEach(missing::add);
            }
        }

        Profile subject = profile == null ? Profile.empty() : profile;
        Preferences preferences = subject.preferences();
        String userPrompt = "User Profile:\n"
            + "- Skills: " + joinOrDefault(subject.skills(), "None specified") + "\n"
            + "- Experience Level: " + orDefault(preferences.experienceLevel(), "Not specified") + "\n"
            + "- Preferred Location: " + orDefault(preferences.location(), "Not specified") + "\n"
            + "- Salary Expectation: " + preferences.salaryText() + "\n\n"
            + "Job Matches and Skill Gaps:\n" + toJson(summary) + "\n\n"
            + "Review these recommendations for quality issues, considering experience level, location, and salary alignment.";

        RawReview raw = invoker.invoke(
            properties.getModels().getReview(),
            new LlmRequest(SYSTEM_PROMPT, userPrompt),
            ReviewStage::readReview
        );

        Set<String> known = reviewed.stream().map(Match::postingId).collect(Collectors.toSet());
        List<ItemFailure> failures = new ArrayList<>();
        Set<String> flagged = new LinkedHashSet<>();
        for (String id : raw.flaggedIds()) {
            if (known.contains(id)) {
                flagged.add(id);
            } else {
                log.warn("Review flagged unknown posting id {}", id);
                failures.add(new ItemFailure(id, ReasonCodeClassifier.UNKNOWN_POSTING_ID, "Review flagged a posting that is not among the matches"));
            }
        }
        List<ReviewCorrection> corrections = new ArrayList<>();
        for (ReviewCorrection correction : raw.corrections()) {
            if (correction.postingId() != null && !known.contains(correction.postingId())) {
                failures.add(new ItemFailure(correction.postingId(), ReasonCodeClassifier.UNKNOWN_POSTING_ID, "Correction refers to a posting that is not among the matches"));
                continue;
            }
            corrections.add(correction);
        }
        log.info("Review produced {} warnings and flagged {} of {} matches", raw.warnings().size(), flagged.size(), reviewed.size());
        return new StageResult<>(new ReviewOutcome(raw.warnings(), flagged, corrections), failures);
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize review prompt", e);
        }
    }

    static RawReview readReview(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("expected a JSON object with warnings, flagged_job_ids and corrections");
        }
        List<ReviewCorrection> corrections = new ArrayList<>();
        JsonNode node = firstPresent(payload, "corrections");
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    String text = item.asText().trim();
                    if (!text.isEmpty()) {
                        corrections.add(new ReviewCorrection(null, text, null));
                    }
                } else if (item.isObject()) {
                    String issue = firstText(item, "issue", "problem", "description");
                    String suggestion = firstText(item, "suggestion", "correction", "fix");
                    if (issue == null && suggestion == null) {
                        continue;
                    }
                    corrections.add(new ReviewCorrection(firstText(item, "job_id", "posting_id", "id"), issue, suggestion));
                }
            }
        }
        return new RawReview(
            stringList(payload, "warnings"),
            stringList(payload, "flagged_job_ids", "flagged_posting_ids", "flagged_ids"),
            corrections
        );
    }

    record RawReview(List<String> warnings, List<String> flaggedIds, List<ReviewCorrection> corrections) {
    }
}
