package com.delta.jobmatcher.match.stage;

/**
 * The one scoring contract shared by the lightweight and the full ranking calls, so a
 * posting's score means the same thing on both paths.
 */
final class ScoringRubric {
    static final String TEXT = """
        Score each job between 0.0 and 1.0:
        - 1.0 = perfect match, all requirements met
        - 0.7-0.9 = strong match, most requirements met
        - 0.4-0.6 = moderate match, some requirements met
        - 0.1-0.3 = weak match, few requirements met
        - 0.0 = no match
        Consider skills, experience level, target roles, location and salary expectations.""";

    private ScoringRubric() {
    }
}
