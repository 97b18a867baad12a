package uk.gegc.livequiz.shared.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.livequiz.shared.config.RateLimitProperties;
import uk.gegc.livequiz.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitServiceTest {

    private RateLimitService rateLimitService;

    @BeforeEach
    void setUp() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setMaxRequests(2);
        properties.setWindowSeconds(60);
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);
        rateLimitService = new RateLimitService(new InMemoryRateLimitStore(), properties, clock);
    }

    @Test
    @DisplayName("throws once the configured limit is reached")
    void checkRateLimit_throwsAfterLimit() {
        rateLimitService.checkRateLimit("submit-answer", "s1:p1");
        rateLimitService.checkRateLimit("submit-answer", "s1:p1");

        assertThatThrownBy(() -> rateLimitService.checkRateLimit("submit-answer", "s1:p1"))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessageContaining("submit-answer");
    }

    @Test
    @DisplayName("operations are limited separately for the same identifier")
    void checkRateLimit_separatesOperations() {
        rateLimitService.checkRateLimit("submit-answer", "s1:p1");
        rateLimitService.checkRateLimit("submit-answer", "s1:p1");

        assertThatCode(() -> rateLimitService.checkRateLimit("submit-ratings", "s1:p1"))
                .doesNotThrowAnyException();
    }
}
