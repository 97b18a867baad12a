package uk.gegc.livequiz.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A caller went over the request ceiling of an operation.
 * The retry delay ends up in the {@code Retry-After} header.
 */
@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class RateLimitExceededException extends RuntimeException {

    private static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message) {
        this(message, DEFAULT_RETRY_AFTER_SECONDS);
    }

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        // Retry-After is whole seconds and never zero
        this.retryAfterSeconds = retryAfterSeconds < 1 ? 1 : retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
