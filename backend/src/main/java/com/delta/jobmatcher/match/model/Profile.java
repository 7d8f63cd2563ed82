package com.delta.jobmatcher.match.model;

import java.util.List;

public record Profile(
    String name,
    String headline,
    String summary,
    List<String> skills,
    List<ExperienceRecord> experience,
    List<EducationRecord> education,
    Preferences preferences
) {
    public Profile {
        skills = skills == null ? List.of() : List.copyOf(skills);
        experience = experience == null ? List.of() : List.copyOf(experience);
        education = education == null ? List.of() : List.copyOf(education);
        preferences = preferences == null ? Preferences.none() : preferences;
    }

    public static Profile empty() {
        return new Profile(null, null, null, List.of(), List.of(), List.of(), Preferences.none());
    }
}
