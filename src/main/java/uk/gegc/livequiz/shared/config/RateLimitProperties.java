package uk.gegc.livequiz.shared.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "livequiz.rate-limit")
@Validated
@Data
public class RateLimitProperties {
    /**
     * Requests admitted per identifier within one window.
     */
    @Positive
    private int maxRequests = 60;

    @Positive
    private int windowSeconds = 60;

    /**
     * Interval of the background sweep that evicts expired windows.
     */
    @Positive
    private long sweepIntervalMillis = 60000L;
}
