package linkguard.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import linkguard.core.model.ratelimit.TokenBucketState;

/**
 * Atomic primitives of the shared key-value store used by the rate limiters.
 *
 * <p>Every method is a single atomic step against the store: two concurrent
 * calls for the same key are both fully applied.
 */
public interface RateLimitStore {

    /**
     * Increment a counter and set its expiry in one step.
     *
     * @param key the counter key
     * @param ttl expiry applied to the key
     * @return the counter value after the increment
     */
    Uni<Long> incrementAndExpire(String key, Duration ttl);

    /**
     * Purge entries older than {@code windowStartNanos}, record {@code eventNanos},
     * and return the resulting cardinality, refreshing the expiry.
     *
     * @param key the log key
     * @param windowStartNanos entries with a lower score are removed
     * @param eventNanos the score and member of the new entry
     * @param ttl expiry applied to the key
     * @return number of entries after insertion
     */
    Uni<Long> recordAndCount(String key, long windowStartNanos, long eventNanos, Duration ttl);

    /**
     * Refill a token bucket and try to take one token.
     *
     * @param key the identity key; the store derives the tokens and last refill keys from it
     * @param capacity bucket capacity
     * @param refillRatePerSecond refill rate
     * @param nowEpochSeconds current time in epoch seconds
     * @param ttl expiry applied to both scalars
     * @return the bucket state after the step
     */
    Uni<TokenBucketState> takeToken(
            String key, long capacity, double refillRatePerSecond, long nowEpochSeconds, Duration ttl);
}
