package uk.gegc.livequiz.shared.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uk.gegc.livequiz.shared.config.RateLimitProperties;
import uk.gegc.livequiz.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitService {

    private final RateLimitStore store;
    private final RateLimitProperties properties;
    private final Clock clock;

    public void checkRateLimit(String operation, String identifier) {
        checkRateLimit(operation, identifier, properties.getMaxRequests());
    }

    public void checkRateLimit(String operation, String identifier, int limitPerWindow) {
        String key = operation + ":" + identifier;
        RateLimitDecision decision = store.tryAcquire(
                key,
                limitPerWindow,
                Duration.ofSeconds(properties.getWindowSeconds()),
                clock.instant()
        );
        if (!decision.allowed()) {
            log.debug("Rate limit hit for {} (retry in {}s)", key, decision.retryAfterSeconds());
            throw new RateLimitExceededException("Too many requests for " + operation, decision.retryAfterSeconds());
        }
    }

    @Scheduled(fixedDelayString = "${livequiz.rate-limit.sweep-interval-millis:60000}")
    public void sweepExpiredWindows() {
        int evicted = store.evictExpired(clock.instant());
        if (evicted > 0) {
            log.debug("Evicted {} expired rate limit windows, {} remaining", evicted, store.size());
        }
    }
}
