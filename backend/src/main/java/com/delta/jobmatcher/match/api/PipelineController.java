package com.delta.jobmatcher.match.api;

import com.delta.jobmatcher.match.llm.SlidingWindowRateLimiter;
import com.delta.jobmatcher.match.model.FinalReport;
import com.delta.jobmatcher.match.model.Profile;
import com.delta.jobmatcher.match.model.QuickRankResult;
import com.delta.jobmatcher.match.service.PipelineOrchestratorService;
import com.delta.jobmatcher.match.stage.ProfileExtractionStage;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class PipelineController {
    private final PipelineOrchestratorService orchestratorService;
    private final ProfileExtractionStage profileExtractionStage;
    private final SlidingWindowRateLimiter rateLimiter;

    public PipelineController(
        PipelineOrchestratorService orchestratorService,
        ProfileExtractionStage profileExtractionStage,
        SlidingWindowRateLimiter rateLimiter
    ) {
        this.orchestratorService = orchestratorService;
        this.profileExtractionStage = profileExtractionStage;
        this.rateLimiter = rateLimiter;
    }

    @PostMapping("/pipeline/run")
    public FinalReport runPipeline(@RequestBody PipelineRunRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        if (request.topK() != null && request.topK() < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "topK must be >= 1");
        }
        return orchestratorService.runFull(profileOrEmpty(request.profile()), request.postings(), request.topK());
    }

    @PostMapping("/pipeline/single")
    public FinalReport runSingleJob(@RequestBody SingleJobRunRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        return orchestratorService.runSingleJob(profileOrEmpty(request.profile()), request.postings(), request.postingId());
    }

    @PostMapping("/pipeline/quick-rank")
    public QuickRankResult quickRank(@RequestBody QuickRankRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        return orchestratorService.quickRank(profileOrEmpty(request.profile()), request.postings());
    }

    @PostMapping("/profile/extract")
    public Profile extractProfile(@RequestBody ProfileExtractRequest request) {
        if (request == null || request.resumeText() == null || request.resumeText().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "resumeText is required");
        }
        return profileExtractionStage.extract(request.resumeText());
    }

    @GetMapping("/rate-limit/{modelId}")
    public RateLimitStatusView rateLimitStatus(@PathVariable("modelId") String modelId) {
        return new RateLimitStatusView(
            modelId,
            rateLimiter.recentCount(modelId),
            rateLimiter.quotaFor(modelId),
            rateLimiter.windowLength().toSeconds()
        );
    }

    private Profile profileOrEmpty(Profile profile) {
        return profile == null ? Profile.empty() : profile;
    }
}
