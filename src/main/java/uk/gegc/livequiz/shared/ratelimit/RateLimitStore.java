package uk.gegc.livequiz.shared.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request counters keyed by an arbitrary identifier.
 * Implementations must make {@link #tryAcquire} atomic per key.
 */
public interface RateLimitStore {

    RateLimitDecision tryAcquire(String key, int maxRequests, Duration window, Instant now);

    /**
     * Removes every window that has already reset.
     *
     * @return number of evicted keys
     */
    int evictExpired(Instant now);

    int size();

    void clear();
}
