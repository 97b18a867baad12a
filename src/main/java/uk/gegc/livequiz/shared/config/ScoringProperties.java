package uk.gegc.livequiz.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Timing and leaderboard parameters shared by the scoring and aggregation paths.
 */
@Configuration
@ConfigurationProperties(prefix = "livequiz.scoring")
@Validated
@Data
public class ScoringProperties {
    /**
     * Time limit applied when an answer key entry does not declare one.
     */
    @Positive
    private int defaultTimeLimitSeconds = 20;

    /**
     * Network allowance past the server-side deadline before a submission is refused.
     */
    @Min(0)
    private long gracePeriodMillis = 2000L;

    /**
     * Number of entries in the visible leaderboard and in position history tracking.
     */
    @Positive
    private int leaderboardSize = 20;
}
