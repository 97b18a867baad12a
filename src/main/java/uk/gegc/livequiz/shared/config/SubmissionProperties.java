package uk.gegc.livequiz.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for the answer commit transaction.
 */
@Configuration
@ConfigurationProperties(prefix = "livequiz.submission")
@Validated
@Data
public class SubmissionProperties {
    @Positive
    private int maxCommitAttempts = 3;

    /**
     * Base backoff between commit attempts, multiplied by the attempt number.
     */
    @Min(0)
    private long retryBackoffMillis = 25L;
}
