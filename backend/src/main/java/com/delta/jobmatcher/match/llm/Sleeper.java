package com.delta.jobmatcher.match.llm;

import java.time.Duration;

/**
 * Suspends the calling thread. Injected so waits can be observed with a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            long millis = duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
