package com.delta.jobmatcher.match.model;

import java.util.List;

/**
 * Output of one pipeline stage plus the items that could not be processed.
 * Failed items are absent from {@code output}.
 */
public record StageResult<T>(
    T output,
    List<ItemFailure> failures
) {
    public StageResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static <T> StageResult<T> of(T output) {
        return new StageResult<>(output, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
