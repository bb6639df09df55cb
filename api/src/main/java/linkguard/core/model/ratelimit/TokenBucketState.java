package linkguard.core.model.ratelimit;

/**
 * Token bucket state after a refill-and-take step.
 *
 * <p>The same arithmetic runs inside the Redis Lua script; this class is the
 * reference used by the in-memory store.
 *
 * @param tokens tokens left in the bucket, within {@code [0, capacity]}
 * @param lastRefillEpochSeconds the refill timestamp persisted with the tokens
 * @param consumed whether this step took a token
 */
public record TokenBucketState(double tokens, long lastRefillEpochSeconds, boolean consumed) {

    /**
     * Refill a bucket for the elapsed time and try to take one token.
     *
     * @param previous the stored state, or null when the bucket does not exist yet
     * @param capacity the bucket capacity
     * @param refillRatePerSecond tokens added per second
     * @param nowEpochSeconds the current time in epoch seconds
     * @return the new state
     */
    public static TokenBucketState refillAndTake(
            TokenBucketState previous, long capacity, double refillRatePerSecond, long nowEpochSeconds) {
        var tokens = previous != null ? previous.tokens() : (double) capacity;
        final var lastRefill = previous != null ? previous.lastRefillEpochSeconds() : nowEpochSeconds;

        final var elapsed = Math.max(0, nowEpochSeconds - lastRefill);
        tokens = Math.min(capacity, tokens + elapsed * refillRatePerSecond);

        final var consumed = tokens >= 1.0;
        if (consumed) {
            tokens -= 1.0;
        }
        return new TokenBucketState(tokens, nowEpochSeconds, consumed);
    }
}
