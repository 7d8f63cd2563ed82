package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.LlmInvocationException;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.QuotaExceededException;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.llm.Sleeper;
import com.delta.jobmatcher.match.model.ExtractedSkills;
import com.delta.jobmatcher.match.model.GapResult;
import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.LearningResource;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.StageResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.delta.jobmatcher.match.util.JsonNodes.firstPresent;
import static com.delta.jobmatcher.match.util.JsonNodes.firstText;
import static com.delta.jobmatcher.match.util.JsonNodes.stringList;
import static com.delta.jobmatcher.match.util.TextUtils.joinOrDefault;
import static com.delta.jobmatcher.match.util.TextUtils.orDefault;
import static com.delta.jobmatcher.match.util.TextUtils.truncate;
import static com.delta.jobmatcher.match.util.TextUtils.truncateWords;

@Component
public class GapAnalysisStage {
    private static final Logger log = LoggerFactory.getLogger(GapAnalysisStage.class);

    static final String SYSTEM_PROMPT = """
        You are a career advisor and skill gap analyst. Compare the user's skills with the job's requirements.
        Return a JSON object with:
        - matched_skills: skills the user already has that the job requires
        - missing_required_skills: critical skills the user lacks
        - missing_required_skills_writeup: a short narrative (at most 200 words) about the missing skills
        - nice_to_have_skills: beneficial but non-critical skills the user lacks
        - suggested_learning_path: high-level learning steps, no platform branding
        - learning_resources: list of objects with name, url, type (university, online_course,
          certification, bootcamp or training_program) and skill
        Be specific and actionable. Return ONLY valid JSON.""";

    private final RateLimitedInvoker invoker;
    private final MatcherProperties properties;
    private final Sleeper sleeper;

    public GapAnalysisStage(RateLimitedInvoker invoker, MatcherProperties properties, Sleeper sleeper) {
        this.invoker = invoker;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public StageResult<List<GapResult>> analyzeAll(
        Profile profile,
        List<Posting> postings,
        Map<String, ExtractedSkills> skillsById
    ) {
        List<GapResult> gaps = new ArrayList<>();
        List<ItemFailure> failures = new ArrayList<>();
        if (postings == null || postings.isEmpty()) {
            return new StageResult<>(gaps, failures);
        }
        Map<String, ExtractedSkills> skills = skillsById == null ? Map.of() : skillsById;
        MatcherProperties.GapAnalysis config = properties.getGapAnalysis();
        boolean quotaExhausted = false;
        boolean interrupted = false;
        for (int i = 0; i < postings.size(); i++) {
            Posting posting = postings.get(i);
            if (quotaExhausted) {
                failures.add(StageSupport.skippedAfterQuota(posting.id()));
                continue;
            }
            if (!interrupted && i > 0 && !StageSupport.pause(sleeper, config.getInterCallDelayMs())) {
                log.warn("Interrupted during gap analysis; skipping the remaining {} postings", postings.size() - i);
                interrupted = true;
            }
            if (interrupted) {
                failures.add(StageSupport.skippedAfterInterrupt(posting.id()));
                continue;
            }
            try {
                gaps.add(analyze(profile, posting, skills.get(posting.id())));
            } catch (QuotaExceededException e) {
                log.error("Quota exhausted while analyzing gaps for posting {}: {}", posting.id(), e.getMessage());
                failures.add(StageSupport.failureFor(posting.id(), e));
                quotaExhausted = properties.getExtraction().isStopOnQuotaExhausted();
            } catch (LlmInvocationException e) {
                log.warn("Failed to analyze gaps for posting {}: {}", posting.id(), e.getMessage());
                failures.add(StageSupport.failureFor(posting.id(), e));
            }
        }
        log.info("Analyzed skill gaps for {} of {} postings", gaps.size(), postings.size());
        return new StageResult<>(gaps, failures);
    }

    public GapResult analyze(Profile profile, Posting posting, ExtractedSkills skills) {
        ExtractedSkills jobSkills = skills == null ? ExtractedSkills.none(posting.id()) : skills;
        MatcherProperties.GapAnalysis config = properties.getGapAnalysis();
        List<String> userSkills = profile == null ? List.of() : profile.skills();
        String userPrompt = "User Skills: " + joinOrDefault(userSkills, "None specified") + "\n\n"
            + "Job Title: " + posting.title() + "\n"
            + "Company: " + orDefault(posting.company(), "Not specified") + "\n\n"
            + "Job Required Skills:\n"
            + "Hard Skills: " + String.join(", ", jobSkills.hardSkills()) + "\n"
            + "Soft Skills: " + String.join(", ", jobSkills.softSkills()) + "\n"
            + "Tools: " + String.join(", ", jobSkills.tools()) + "\n\n"
            + "Job Description:\n"
            + truncate(posting.description(), config.getMaxDescriptionChars()) + "\n\n"
            + "Analyze the skill gap and provide recommendations with "
            + config.getMinLearningSteps() + " to " + config.getMaxLearningSteps() + " learning steps.";
        return invoker.invoke(
            properties.getModels().getGapAnalysis(),
            new LlmRequest(SYSTEM_PROMPT, userPrompt),
            payload -> readGap(posting, payload, config)
        );
    }

    static GapResult readGap(Posting posting, JsonNode payload, MatcherProperties.GapAnalysis config) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("expected a JSON object with gap analysis fields");
        }
        if (!payload.has("matched_skills") && !payload.has("missing_required_skills")) {
            throw new IllegalArgumentException("neither matched_skills nor missing_required_skills present");
        }
        List<String> learningPath = stringList(payload, "suggested_learning_path", "learning_path");
        if (learningPath.size() > config.getMaxLearningSteps()) {
            learningPath = learningPath.subList(0, config.getMaxLearningSteps());
        }
        String narrative = firstText(payload, "missing_required_skills_writeup", "missing_skills_narrative", "writeup");
        return new GapResult(
            posting.id(),
            posting.title(),
            stringList(payload, "matched_skills"),
            stringList(payload, "missing_required_skills"),
            narrative == null ? null : truncateWords(narrative, config.getMaxNarrativeWords()),
            stringList(payload, "nice_to_have_skills"),
            learningPath,
            readResources(firstPresent(payload, "learning_resources", "resources"))
        );
    }

    private static List<LearningResource> readResources(JsonNode node) {
        List<LearningResource> resources = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return resources;
        }
        for (JsonNode item : node) {
            String name = firstText(item, "name", "title");
            String url = firstText(item, "url", "link");
            if (name == null || url == null) {
                continue;
            }
            resources.add(new LearningResource(name, url, firstText(item, "type"), firstText(item, "skill")));
        }
        return resources;
    }
}
