package com.delta.jobmatcher.match.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record ReviewOutcome(
    List<String> warnings,
    Set<String> flaggedPostingIds,
    List<ReviewCorrection> corrections
) {
    public ReviewOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        flaggedPostingIds = flaggedPostingIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(flaggedPostingIds));
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
    }

    public static ReviewOutcome empty() {
        return new ReviewOutcome(List.of(), Set.of(), List.of());
    }
}
