package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.LlmInvocationException;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.QuotaExceededException;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.llm.Sleeper;
import com.delta.jobmatcher.match.model.ExtractedSkills;
import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.StageResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.delta.jobmatcher.match.util.JsonNodes.firstText;
import static com.delta.jobmatcher.match.util.JsonNodes.stringSet;
import static com.delta.jobmatcher.match.util.TextUtils.orDefault;
import static com.delta.jobmatcher.match.util.TextUtils.truncate;

@Component
public class SkillExtractionStage {
    private static final Logger log = LoggerFactory.getLogger(SkillExtractionStage.class);

    static final String SYSTEM_PROMPT = """
        You are a job analysis expert. Extract structured skills and requirements from a job posting.
        Return a JSON object with:
        - hard_skills: technical skills, programming languages, frameworks
        - soft_skills: personal attributes and communication skills
        - tools: specific software tools, platforms or technologies
        - seniority: one of "entry-level", "junior", "mid-level", "senior", "lead", or null
        Return ONLY valid JSON.""";

    private final RateLimitedInvoker invoker;
    private final MatcherProperties properties;
    private final Sleeper sleeper;

    public SkillExtractionStage(RateLimitedInvoker invoker, MatcherProperties properties, Sleeper sleeper) {
        this.invoker = invoker;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public StageResult<Map<String, ExtractedSkills>> extract(List<Posting> postings) {
        Map<String, ExtractedSkills> skillsById = new LinkedHashMap<>();
        List<ItemFailure> failures = new ArrayList<>();
        if (postings == null || postings.isEmpty()) {
            return new StageResult<>(skillsById, failures);
        }
        MatcherProperties.Extraction config = properties.getExtraction();
        boolean quotaExhausted = false;
        boolean interrupted = false;
        for (int i = 0; i < postings.size(); i++) {
            Posting posting = postings.get(i);
            if (quotaExhausted) {
                failures.add(StageSupport.skippedAfterQuota(posting.id()));
                continue;
            }
            if (!interrupted && i > 0 && !StageSupport.pause(sleeper, config.getInterCallDelayMs())) {
                log.warn("Interrupted during skill extraction; skipping the remaining {} postings", postings.size() - i);
                interrupted = true;
            }
            if (interrupted) {
                failures.add(StageSupport.skippedAfterInterrupt(posting.id()));
                continue;
            }
            try {
                skillsById.put(posting.id(), extractOne(posting));
            } catch (QuotaExceededException e) {
                log.error("Quota exhausted while extracting skills for posting {}: {}", posting.id(), e.getMessage());
                failures.add(StageSupport.failureFor(posting.id(), e));
                quotaExhausted = config.isStopOnQuotaExhausted();
            } catch (LlmInvocationException e) {
                log.warn("Failed to extract skills for posting {}: {}", posting.id(), e.getMessage());
                failures.add(StageSupport.failureFor(posting.id(), e));
            }
        }
        log.info("Extracted skills for {} of {} postings", skillsById.size(), postings.size());
        return new StageResult<>(skillsById, failures);
    }

    public ExtractedSkills extractOne(Posting posting) {
        String userPrompt = "Extract skills and requirements from this job posting:\n\n"
            + "Job Title: " + posting.title() + "\n"
            + "Company: " + orDefault(posting.company(), "Not specified") + "\n"
            + "Description:\n"
            + truncate(posting.description(), properties.getExtraction().getMaxDescriptionChars());
        return invoker.invoke(
            properties.getModels().getExtraction(),
            new LlmRequest(SYSTEM_PROMPT, userPrompt),
            payload -> readSkills(posting.id(), payload)
        );
    }

    static ExtractedSkills readSkills(String postingId, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("expected a JSON object with skill lists");
        }
        if (!payload.has("hard_skills") && !payload.has("soft_skills") && !payload.has("tools")
            && !payload.has("hardSkills") && !payload.has("softSkills")) {
            throw new IllegalArgumentException("none of hard_skills, soft_skills or tools present");
        }
        return new ExtractedSkills(
            postingId,
            stringSet(payload, "hard_skills", "hardSkills"),
            stringSet(payload, "soft_skills", "softSkills"),
            stringSet(payload, "tools"),
            firstText(payload, "seniority")
        );
    }
}
