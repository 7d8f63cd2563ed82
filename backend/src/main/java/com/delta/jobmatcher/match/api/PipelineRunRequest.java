package com.delta.jobmatcher.match.api;

import com.delta.jobmatcher.match.model.Profile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record PipelineRunRequest(
    Profile profile,
    List<JsonNode> postings,
    Integer topK
) {
}
