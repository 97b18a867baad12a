package uk.gegc.livequiz.shared.ratelimit;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-process store. Counters are not shared between instances and are lost on restart.
 */
@Slf4j
@Component
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    @Override
    public RateLimitDecision tryAcquire(String key, int maxRequests, Duration window, Instant now) {
        // compute() runs atomically per key, so the count and the decision agree
        Window updated = windows.compute(key, (k, current) -> {
            if (current == null || !now.isBefore(current.resetAt())) {
                return new Window(1, now.plus(window), true);
            }
            if (current.count() >= maxRequests) {
                return new Window(current.count(), current.resetAt(), false);
            }
            return new Window(current.count() + 1, current.resetAt(), true);
        });

        long retryAfter = secondsUntil(now, updated.resetAt());
        if (!updated.admitted()) {
            return new RateLimitDecision(false, 0, retryAfter);
        }
        return new RateLimitDecision(true, Math.max(0, maxRequests - updated.count()), retryAfter);
    }

    @Override
    public int evictExpired(Instant now) {
        int before = windows.size();
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().resetAt()));
        return before - windows.size();
    }

    @Override
    public int size() {
        return windows.size();
    }

    @Override
    @PreDestroy
    public void clear() {
        log.debug("Clearing {} rate limit windows", windows.size());
        windows.clear();
    }

    private static long secondsUntil(Instant now, Instant resetAt) {
        long millis = Duration.between(now, resetAt).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    private record Window(int count, Instant resetAt, boolean admitted) {
    }
}
