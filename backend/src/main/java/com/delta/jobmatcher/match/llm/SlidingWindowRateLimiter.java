package com.delta.jobmatcher.match.llm;

import com.delta.jobmatcher.config.MatcherProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model sliding-window limiter: at most {@code quota} calls inside any trailing window.
 *
 * <p>Each model keeps the timestamps of its most recent calls. {@link #acquire(String)} drops
 * timestamps that left the window and, when the window is still full, waits until the oldest
 * one leaves before recording the new call. Record mutation happens under a per-model lock,
 * so callers on different threads cannot overshoot the quota.
 */
@Component
public class SlidingWindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final MatcherProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, Object> modelLocks = new ConcurrentHashMap<>();
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(MatcherProperties properties, Clock clock, Sleeper sleeper) {
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a call to {@code modelId} fits in the window, then records it.
     *
     * @return how long the caller was suspended
     */
    public Duration acquire(String modelId) {
        String key = normalizeKey(modelId);
        int quota = properties.getRateLimit().quotaFor(key);
        Duration window = windowLength();
        Duration waited = Duration.ZERO;
        Object lock = modelLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Deque<Instant> record = windows.computeIfAbsent(key, ignored -> new ArrayDeque<>());
            while (true) {
                Instant now = clock.instant();
                evictExpired(record, now, window);
                if (record.size() < quota) {
                    record.addLast(now);
                    return waited;
                }
                Instant oldest = record.peekFirst();
                Duration wait = Duration.between(now, oldest.plus(window));
                if (wait.isNegative() || wait.isZero()) {
                    continue;
                }
                log.info("Rate limit window full for model {} ({}/{}), waiting {} ms", key, record.size(), quota, wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException(key, "interrupted", "Interrupted while waiting for rate limit window", e);
                }
                waited = waited.plus(wait);
            }
        }
    }

    /**
     * Number of calls to {@code modelId} inside the current window.
     */
    public int recentCount(String modelId) {
        String key = normalizeKey(modelId);
        Object lock = modelLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Deque<Instant> record = windows.get(key);
            if (record == null) {
                return 0;
            }
            evictExpired(record, clock.instant(), windowLength());
            return record.size();
        }
    }

    public int quotaFor(String modelId) {
        return properties.getRateLimit().quotaFor(normalizeKey(modelId));
    }

    public Duration windowLength() {
        return Duration.ofSeconds(properties.getRateLimit().getWindowSeconds());
    }

    private void evictExpired(Deque<Instant> record, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!record.isEmpty() && !record.peekFirst().isAfter(cutoff)) {
            record.pollFirst();
        }
    }

    private String normalizeKey(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return "default";
        }
        return modelId.trim();
    }
}
