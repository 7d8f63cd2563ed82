package com.delta.jobmatcher.match.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record QuickRankResult(
    Map<String, Double> scores,
    List<String> warnings
) {
    public QuickRankResult {
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
