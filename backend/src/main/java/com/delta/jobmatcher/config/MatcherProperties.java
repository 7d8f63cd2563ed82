package com.delta.jobmatcher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "matcher")
public class MatcherProperties {
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Models models = new Models();
    private Extraction extraction = new Extraction();
    private Ranking ranking = new Ranking();
    private GapAnalysis gapAnalysis = new GapAnalysis();
    private Review review = new Review();
    private Roadmap roadmap = new Roadmap();
    private Pipeline pipeline = new Pipeline();
    private Gemini gemini = new Gemini();

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Models getModels() {
        return models;
    }

    public void setModels(Models models) {
        this.models = models;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public void setRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    public GapAnalysis getGapAnalysis() {
        return gapAnalysis;
    }

    public void setGapAnalysis(GapAnalysis gapAnalysis) {
        this.gapAnalysis = gapAnalysis;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review;
    }

    public Roadmap getRoadmap() {
        return roadmap;
    }

    public void setRoadmap(Roadmap roadmap) {
        this.roadmap = roadmap;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Gemini getGemini() {
        return gemini;
    }

    public void setGemini(Gemini gemini) {
        this.gemini = gemini;
    }

    public static class RateLimit {
        private int requestsPerMinute = 15;
        private int windowSeconds = 60;
        private Map<String, Integer> perModel = new LinkedHashMap<>();

        public int getRequestsPerMinute() {
            return Math.max(1, requestsPerMinute);
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = Math.max(1, requestsPerMinute);
        }

        public int getWindowSeconds() {
            return Math.max(1, windowSeconds);
        }

        public void setWindowSeconds(int windowSeconds) {
            this.windowSeconds = Math.max(1, windowSeconds);
        }

        public Map<String, Integer> getPerModel() {
            return perModel;
        }

        public void setPerModel(Map<String, Integer> perModel) {
            this.perModel = perModel == null ? new LinkedHashMap<>() : new LinkedHashMap<>(perModel);
        }

        public int quotaFor(String modelId) {
            Integer override = modelId == null ? null : perModel.get(modelId);
            if (override == null || override <= 0) {
                return getRequestsPerMinute();
            }
            return override;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 2000;
        private int maxDelayMs = 60000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    /**
     * Model identifiers per stage. Each identifier gets its own rate-limit window.
     */
    public static class Models {
        private String defaultModel = "gemini-2.0-flash";
        private String profile;
        private String extraction;
        private String ranking;
        private String gapAnalysis;
        private String review;

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public String getProfile() {
            return orDefault(profile);
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }

        public String getExtraction() {
            return orDefault(extraction);
        }

        public void setExtraction(String extraction) {
            this.extraction = extraction;
        }

        public String getRanking() {
            return orDefault(ranking);
        }

        public void setRanking(String ranking) {
            this.ranking = ranking;
        }

        public String getGapAnalysis() {
            return orDefault(gapAnalysis);
        }

        public void setGapAnalysis(String gapAnalysis) {
            this.gapAnalysis = gapAnalysis;
        }

        public String getReview() {
            return orDefault(review);
        }

        public void setReview(String review) {
            this.review = review;
        }

        private String orDefault(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return defaultModel;
            }
            return candidate.trim();
        }
    }

    public static class Extraction {
        private int maxDescriptionChars = 3000;
        private int interCallDelayMs = 500;
        private boolean stopOnQuotaExhausted = true;
        private int maxResumeChars = 4000;

        public int getMaxDescriptionChars() {
            return Math.max(1, maxDescriptionChars);
        }

        public void setMaxDescriptionChars(int maxDescriptionChars) {
            this.maxDescriptionChars = Math.max(1, maxDescriptionChars);
        }

        public int getInterCallDelayMs() {
            return Math.max(0, interCallDelayMs);
        }

        public void setInterCallDelayMs(int interCallDelayMs) {
            this.interCallDelayMs = Math.max(0, interCallDelayMs);
        }

        public boolean isStopOnQuotaExhausted() {
            return stopOnQuotaExhausted;
        }

        public void setStopOnQuotaExhausted(boolean stopOnQuotaExhausted) {
            this.stopOnQuotaExhausted = stopOnQuotaExhausted;
        }

        public int getMaxResumeChars() {
            return Math.max(1, maxResumeChars);
        }

        public void setMaxResumeChars(int maxResumeChars) {
            this.maxResumeChars = Math.max(1, maxResumeChars);
        }
    }

    public static class Ranking {
        private int maxPostings = 50;
        private int descriptionChars = 500;
        private int quickMaxPostings = 50;
        private int quickDescriptionChars = 300;
        private int defaultTopK = 10;
        private int maxSkillsPerCategory = 10;

        public int getMaxPostings() {
            return Math.max(1, maxPostings);
        }

        public void setMaxPostings(int maxPostings) {
            this.maxPostings = Math.max(1, maxPostings);
        }

        public int getDescriptionChars() {
            return Math.max(1, descriptionChars);
        }

        public void setDescriptionChars(int descriptionChars) {
            this.descriptionChars = Math.max(1, descriptionChars);
        }

        public int getQuickMaxPostings() {
            return Math.min(50, Math.max(1, quickMaxPostings));
        }

        public void setQuickMaxPostings(int quickMaxPostings) {
            this.quickMaxPostings = Math.min(50, Math.max(1, quickMaxPostings));
        }

        public int getQuickDescriptionChars() {
            return Math.max(1, quickDescriptionChars);
        }

        public void setQuickDescriptionChars(int quickDescriptionChars) {
            this.quickDescriptionChars = Math.max(1, quickDescriptionChars);
        }

        public int getDefaultTopK() {
            return Math.max(1, defaultTopK);
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = Math.max(1, defaultTopK);
        }

        public int getMaxSkillsPerCategory() {
            return Math.max(1, maxSkillsPerCategory);
        }

        public void setMaxSkillsPerCategory(int maxSkillsPerCategory) {
            this.maxSkillsPerCategory = Math.max(1, maxSkillsPerCategory);
        }
    }

    public static class GapAnalysis {
        private int maxDescriptionChars = 2000;
        private int interCallDelayMs = 500;
        private int maxNarrativeWords = 200;
        private int minLearningSteps = 3;
        private int maxLearningSteps = 5;

        public int getMaxDescriptionChars() {
            return Math.max(1, maxDescriptionChars);
        }

        public void setMaxDescriptionChars(int maxDescriptionChars) {
            this.maxDescriptionChars = Math.max(1, maxDescriptionChars);
        }

        public int getInterCallDelayMs() {
            return Math.max(0, interCallDelayMs);
        }

        public void setInterCallDelayMs(int interCallDelayMs) {
            this.interCallDelayMs = Math.max(0, interCallDelayMs);
        }

        public int getMaxNarrativeWords() {
            return Math.max(1, maxNarrativeWords);
        }

        public void setMaxNarrativeWords(int maxNarrativeWords) {
            this.maxNarrativeWords = Math.max(1, maxNarrativeWords);
        }

        public int getMinLearningSteps() {
            return Math.max(1, minLearningSteps);
        }

        public void setMinLearningSteps(int minLearningSteps) {
            this.minLearningSteps = Math.max(1, minLearningSteps);
        }

        public int getMaxLearningSteps() {
            return Math.max(getMinLearningSteps(), maxLearningSteps);
        }

        public void setMaxLearningSteps(int maxLearningSteps) {
            this.maxLearningSteps = Math.max(1, maxLearningSteps);
        }
    }

    public static class Review {
        private int maxMatches = 20;
        private int maxSkillsPerMatch = 5;

        public int getMaxMatches() {
            return Math.min(20, Math.max(1, maxMatches));
        }

        public void setMaxMatches(int maxMatches) {
            this.maxMatches = Math.min(20, Math.max(1, maxMatches));
        }

        public int getMaxSkillsPerMatch() {
            return Math.max(1, maxSkillsPerMatch);
        }

        public void setMaxSkillsPerMatch(int maxSkillsPerMatch) {
            this.maxSkillsPerMatch = Math.max(1, maxSkillsPerMatch);
        }
    }

    public static class Roadmap {
        private int maxResources = 10;
        private int maxSteps = 10;

        public int getMaxResources() {
            return Math.min(10, Math.max(1, maxResources));
        }

        public void setMaxResources(int maxResources) {
            this.maxResources = Math.min(10, Math.max(1, maxResources));
        }

        public int getMaxSteps() {
            return Math.max(1, maxSteps);
        }

        public void setMaxSteps(int maxSteps) {
            this.maxSteps = Math.max(1, maxSteps);
        }
    }

    public static class Pipeline {
        private boolean reviewSingleJob = false;

        public boolean isReviewSingleJob() {
            return reviewSingleJob;
        }

        public void setReviewSingleJob(boolean reviewSingleJob) {
            this.reviewSingleJob = reviewSingleJob;
        }
    }

    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String apiKey;
        private int requestTimeoutSeconds = 60;
        private double temperature = 0.2;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "https://generativelanguage.googleapis.com";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }
}
