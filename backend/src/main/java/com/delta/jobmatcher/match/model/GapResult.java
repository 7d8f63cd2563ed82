package com.delta.jobmatcher.match.model;

import java.util.List;

public record GapResult(
    String postingId,
    String postingTitle,
    List<String> matchedSkills,
    List<String> missingRequiredSkills,
    String missingSkillsNarrative,
    List<String> niceToHaveSkills,
    List<String> learningPath,
    List<LearningResource> learningResources
) {
    public GapResult {
        matchedSkills = matchedSkills == null ? List.of() : List.copyOf(matchedSkills);
        missingRequiredSkills = missingRequiredSkills == null ? List.of() : List.copyOf(missingRequiredSkills);
        niceToHaveSkills = niceToHaveSkills == null ? List.of() : List.copyOf(niceToHaveSkills);
        learningPath = learningPath == null ? List.of() : List.copyOf(learningPath);
        learningResources = learningResources == null ? List.of() : List.copyOf(learningResources);
    }
}
