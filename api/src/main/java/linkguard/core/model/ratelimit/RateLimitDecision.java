package linkguard.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a single rate limit check.
 *
 * @param allowed whether the request is admitted
 * @param remaining requests remaining before denial (never negative)
 * @param limit the configured limit
 * @param resetAt when the quota resets, at whole-second precision
 */
public record RateLimitDecision(boolean allowed, long remaining, long limit, Instant resetAt) {

    public RateLimitDecision {
        remaining = Math.max(0, remaining);
    }

    /**
     * Create an "allowed" decision.
     *
     * @param remaining remaining requests
     * @param limit the configured limit
     * @param resetAt when the quota resets
     * @return an allowed decision
     */
    public static RateLimitDecision allow(long remaining, long limit, Instant resetAt) {
        return new RateLimitDecision(true, remaining, limit, resetAt);
    }

    /**
     * Create a "rejected" decision.
     *
     * @param remaining remaining requests (normally 0)
     * @param limit the configured limit
     * @param resetAt when the quota resets
     * @return a rejected decision
     */
    public static RateLimitDecision rejected(long remaining, long limit, Instant resetAt) {
        return new RateLimitDecision(false, remaining, limit, resetAt);
    }

    /**
     * Return the reset time as epoch seconds for response headers.
     *
     * @return reset time as epoch seconds
     */
    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }

    /**
     * Seconds until the quota resets, relative to {@code now}.
     *
     * @param now the current time
     * @return seconds until reset, floored at zero
     */
    public long retryAfterSeconds(Instant now) {
        return Math.max(0, resetAt.getEpochSecond() - now.getEpochSecond());
    }
}
