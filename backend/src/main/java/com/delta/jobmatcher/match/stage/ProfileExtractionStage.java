package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.llm.LlmRequest;
import com.delta.jobmatcher.match.llm.RateLimitedInvoker;
import com.delta.jobmatcher.match.model.EducationRecord;
import com.delta.jobmatcher.match.model.ExperienceRecord;
import com.delta.jobmatcher.match.model.Preferences;
import com.delta.jobmatcher.match.model.Profile;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.delta.jobmatcher.match.util.JsonNodes.firstPresent;
import static com.delta.jobmatcher.match.util.JsonNodes.firstText;
import static com.delta.jobmatcher.match.util.JsonNodes.number;
import static com.delta.jobmatcher.match.util.JsonNodes.stringList;
import static com.delta.jobmatcher.match.util.TextUtils.truncate;

/**
 * Turns free resume text into a structured {@link Profile}. Model failures propagate to the caller.
 */
@Component
public class ProfileExtractionStage {
    private static final Logger log = LoggerFactory.getLogger(ProfileExtractionStage.class);

    static final String SYSTEM_PROMPT = """
        You are a resume parser. Extract a structured profile from the resume text.
        Return a JSON object with:
        - name, headline, summary: strings or null
        - skills: list of skill names
        - experience: list of objects with company, title, duration, responsibilities
        - education: list of objects with institution, degree, field, year
        - preferences: object with target_roles (list), experience_level, location,
          salary_min, salary_max (numbers or null) and salary_currency
        Use null for anything the resume does not state. Return ONLY valid JSON.""";

    private final RateLimitedInvoker invoker;
    private final MatcherProperties properties;

    public ProfileExtractionStage(RateLimitedInvoker invoker, MatcherProperties properties) {
        this.invoker = invoker;
        this.properties = properties;
    }

    public Profile extract(String resumeText) {
        if (resumeText == null || resumeText.isBlank()) {
            throw new IllegalArgumentException("resumeText is required");
        }
        String userPrompt = "Resume:\n" + truncate(resumeText.trim(), properties.getExtraction().getMaxResumeChars())
            + "\n\nExtract the profile.";
        Profile profile = invoker.invoke(
            properties.getModels().getProfile(),
            new LlmRequest(SYSTEM_PROMPT, userPrompt),
            ProfileExtractionStage::readProfile
        );
        log.info("Extracted profile with {} skills and {} experience entries", profile.skills().size(), profile.experience().size());
        return profile;
    }

    static Profile readProfile(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("expected a JSON object describing the profile");
        }
        List<ExperienceRecord> experience = new ArrayList<>();
        JsonNode experienceNode = firstPresent(payload, "experience", "work_experience");
        if (experienceNode != null && experienceNode.isArray()) {
            for (JsonNode item : experienceNode) {
                String company = firstText(item, "company", "employer");
                String title = firstText(item, "title", "role", "position");
                if (company == null && title == null) {
                    continue;
                }
                experience.add(new ExperienceRecord(
                    company,
                    title,
                    firstText(item, "duration", "period"),
                    responsibilities(item)
                ));
            }
        }
        List<EducationRecord> education = new ArrayList<>();
        JsonNode educationNode = firstPresent(payload, "education");
        if (educationNode != null && educationNode.isArray()) {
            for (JsonNode item : educationNode) {
                String institution = firstText(item, "institution", "school", "university");
                String degree = firstText(item, "degree", "qualification");
                if (institution == null && degree == null) {
                    continue;
                }
                education.add(new EducationRecord(
                    institution,
                    degree,
                    firstText(item, "field", "field_of_study", "major"),
                    firstText(item, "year", "graduation_year")
                ));
            }
        }
        return new Profile(
            firstText(payload, "name"),
            firstText(payload, "headline", "title"),
            firstText(payload, "summary"),
            stringList(payload, "skills"),
            experience,
            education,
            readPreferences(firstPresent(payload, "preferences"))
        );
    }

    private static String responsibilities(JsonNode item) {
        String text = firstText(item, "responsibilities", "description");
        if (text != null) {
            return text;
        }
        List<String> bullets = stringList(item, "responsibilities");
        return bullets.isEmpty() ? null : String.join("; ", bullets);
    }

    private static Preferences readPreferences(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Preferences.none();
        }
        Double min = number(node, "salary_min", "salaryMin");
        Double max = number(node, "salary_max", "salaryMax");
        return new Preferences(
            stringList(node, "target_roles", "targetRoles"),
            firstText(node, "experience_level", "experienceLevel"),
            firstText(node, "location"),
            min == null ? null : (int) Math.round(min),
            max == null ? null : (int) Math.round(max),
            firstText(node, "salary_currency", "salaryCurrency")
        );
    }
}
