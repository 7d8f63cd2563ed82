package com.delta.jobmatcher.match.service;

import com.delta.jobmatcher.config.MatcherProperties;
import com.delta.jobmatcher.match.model.FinalReport;
import com.delta.jobmatcher.match.model.GapResult;
import com.delta.jobmatcher.match.model.LearningResource;
import com.delta.jobmatcher.match.model.Match;
import com.delta.jobmatcher.match.model.PipelineMode;
import com.delta.jobmatcher.match.model.ReviewOutcome;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.delta.jobmatcher.match.util.TextUtils.orDefault;

/**
 * Folds the outputs of a finished run into a {@link FinalReport}. No model calls, no I/O.
 */
@Component
public class ReportAggregator {
    private final MatcherProperties properties;

    public ReportAggregator(MatcherProperties properties) {
        this.properties = properties;
    }

    public FinalReport aggregate(PipelineRun run, Instant finishedAt) {
        ReviewOutcome review = run.review();
        List<String> warnings = new ArrayList<>(run.warnings());
        warnings.addAll(review.warnings());
        return new FinalReport(
            run.runId(),
            run.mode(),
            status(run),
            run.startedAt(),
            finishedAt,
            run.matches(),
            run.gaps(),
            roadmap(run.gaps(), properties.getRoadmap().getMaxResources()),
            upskillingSteps(run.gaps(), properties.getRoadmap().getMaxSteps()),
            summary(run),
            warnings,
            review.flaggedPostingIds(),
            review.corrections(),
            run.stateTrail()
        );
    }

    static String status(PipelineRun run) {
        if (run.postings().isEmpty()) {
            return FinalReport.STATUS_NO_POSTINGS;
        }
        return run.warnings().isEmpty() ? FinalReport.STATUS_COMPLETED : FinalReport.STATUS_COMPLETED_WITH_WARNINGS;
    }

    /**
     * Resources across all gaps, first occurrence wins, keyed by trimmed name and URL.
     */
    static List<LearningResource> roadmap(List<GapResult> gaps, int maxResources) {
        List<LearningResource> roadmap = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        for (GapResult gap : gaps) {
            for (LearningResource resource : gap.learningResources()) {
                if (roadmap.size() >= maxResources) {
                    return roadmap;
                }
                if (seen.add(resource.identityKey())) {
                    roadmap.add(resource);
                }
            }
        }
        return roadmap;
    }

    static List<String> upskillingSteps(List<GapResult> gaps, int maxSteps) {
        List<String> steps = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (GapResult gap : gaps) {
            for (String step : gap.learningPath()) {
                if (steps.size() >= maxSteps) {
                    return steps;
                }
                if (step == null || step.isBlank()) {
                    continue;
                }
                String trimmed = step.trim();
                if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                    steps.add(trimmed);
                }
            }
        }
        return steps;
    }

    static String summary(PipelineRun run) {
        if (run.postings().isEmpty()) {
            return "No valid job postings to analyze.";
        }
        List<String> sentences = new ArrayList<>();
        if (run.mode() == PipelineMode.FULL) {
            sentences.add("Ranked " + jobs(run.matches().size()) + " out of " + run.postings().size() + " postings.");
        }
        sentences.add("Analyzed skill gaps for " + jobs(run.gaps().size()) + ".");
        if (!run.matches().isEmpty()) {
            Match top = run.matches().get(0);
            sentences.add(String.format(
                Locale.ROOT,
                "Top match: %s at %s (score %.2f).",
                top.posting().title(),
                orDefault(top.posting().company(), "an unnamed company"),
                top.score()
            ));
        } else if (run.mode() == PipelineMode.SINGLE_JOB && !run.gaps().isEmpty()) {
            GapResult gap = run.gaps().get(0);
            sentences.add(String.format(
                Locale.ROOT,
                "%s: %d matched and %d missing required skills.",
                gap.postingTitle(),
                gap.matchedSkills().size(),
                gap.missingRequiredSkills().size()
            ));
        }
        int flagged = run.review().flaggedPostingIds().size();
        if (flagged > 0) {
            sentences.add(jobs(flagged) + " flagged for review.");
        }
        return String.join(" ", sentences);
    }

    private static String jobs(int count) {
        return count == 1 ? "1 job" : count + " jobs";
    }
}
