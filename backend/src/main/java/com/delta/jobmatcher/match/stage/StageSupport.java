package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.match.llm.LlmInvocationException;
import com.delta.jobmatcher.match.llm.Sleeper;
import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

final class StageSupport {
    private StageSupport() {
    }

    /**
     * Fixed pause between consecutive per-item calls. Returns false when interrupted.
     */
    static boolean pause(Sleeper sleeper, int delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static ItemFailure failureFor(String itemId, LlmInvocationException e) {
        String reason = e.reasonCode() == null ? ReasonCodeClassifier.UNKNOWN : e.reasonCode();
        return new ItemFailure(itemId, reason, e.getMessage());
    }

    static ItemFailure skippedAfterQuota(String itemId) {
        return new ItemFailure(
            itemId,
            ReasonCodeClassifier.SKIPPED_QUOTA_EXHAUSTED,
            "Skipped because the model quota was exhausted earlier in this stage"
        );
    }

    static ItemFailure skippedAfterInterrupt(String itemId) {
        return new ItemFailure(
            itemId,
            ReasonCodeClassifier.SKIPPED_INTERRUPTED,
            "Skipped because the stage was interrupted"
        );
    }

    static Map<String, Posting> byId(Collection<Posting> postings) {
        return postings.stream()
            .collect(Collectors.toMap(Posting::id, Function.identity(), (first, ignored) -> first, LinkedHashMap::new));
    }
}
