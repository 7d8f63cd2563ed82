package com.delta.jobmatcher.match.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record ExtractedSkills(
    String postingId,
    Set<String> hardSkills,
    Set<String> softSkills,
    Set<String> tools,
    String seniority
) {
    public ExtractedSkills {
        hardSkills = frozen(hardSkills);
        softSkills = frozen(softSkills);
        tools = frozen(tools);
    }

    public static ExtractedSkills none(String postingId) {
        return new ExtractedSkills(postingId, Set.of(), Set.of(), Set.of(), null);
    }

    private static Set<String> frozen(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
