package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.match.model.EducationRecord;
import com.delta.jobmatcher.match.model.ExperienceRecord;
import com.delta.jobmatcher.match.model.Preferences;
import com.delta.jobmatcher.match.model.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.delta.jobmatcher.match.util.TextUtils.orDefault;

/**
 * Deterministic plain-text rendering of a profile for ranking prompts.
 */
@Component
public class ProfileSummarizer {
    static final int MAX_EXPERIENCE = 5;
    static final int MAX_EDUCATION = 3;

    public String summarize(Profile profile) {
        if (profile == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        addIfPresent(lines, "Name", profile.name());
        addIfPresent(lines, "Headline", profile.headline());
        addIfPresent(lines, "Summary", profile.summary());
        if (!profile.skills().isEmpty()) {
            lines.add("Skills: " + String.join(", ", profile.skills()));
        }
        if (!profile.experience().isEmpty()) {
            lines.add("Experience:");
            for (ExperienceRecord exp : profile.experience().stream().limit(MAX_EXPERIENCE).toList()) {
                String duration = exp.duration() == null || exp.duration().isBlank() ? "" : " (" + exp.duration() + ")";
                lines.add("  - " + orDefault(exp.title(), "Unknown") + " at " + orDefault(exp.company(), "Unknown") + duration);
            }
        }
        if (!profile.education().isEmpty()) {
            lines.add("Education:");
            for (EducationRecord edu : profile.education().stream().limit(MAX_EDUCATION).toList()) {
                lines.add("  - " + orDefault(edu.degree(), "") + " in " + orDefault(edu.field(), "") + " from " + orDefault(edu.institution(), ""));
            }
        }
        Preferences preferences = profile.preferences();
        if (!preferences.targetRoles().isEmpty()) {
            lines.add("Target Roles: " + String.join(", ", preferences.targetRoles()));
        }
        addIfPresent(lines, "Experience Level", preferences.experienceLevel());
        addIfPresent(lines, "Preferred Location", preferences.location());
        if (preferences.salaryMin() != null || preferences.salaryMax() != null) {
            lines.add("Salary Expectation: " + preferences.salaryText());
        }
        return String.join("\n", lines);
    }

    private void addIfPresent(List<String> lines, String label, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(label + ": " + value);
        }
    }
}
