package com.delta.jobmatcher.match.model;

import java.util.List;

public record LearningResource(
    String name,
    String url,
    String type,
    String skill
) {
    /**
     * Identity used when merging resources across jobs: two entries with the same
     * name and URL are the same resource whatever skill they were attached to.
     */
    public List<String> identityKey() {
        return List.of(name == null ? "" : name.trim(), url == null ? "" : url.trim());
    }
}
