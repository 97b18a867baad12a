package uk.gegc.livequiz.shared.ratelimit;

/**
 * Outcome of one admission check.
 *
 * @param allowed           whether the request is admitted
 * @param remaining         requests still admitted in the current window
 * @param retryAfterSeconds seconds until the current window resets
 */
public record RateLimitDecision(boolean allowed, int remaining, long retryAfterSeconds) {
}
