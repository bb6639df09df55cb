package linkguard.core.model.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * The limit applied by a single rate limiter instance.
 *
 * @param limit the maximum requests allowed per window (also the token bucket capacity)
 * @param window the window duration
 */
public record RateLimitPolicy(long limit, Duration window) {

    /**
     * Create a policy with validation.
     *
     * <p>A non-positive limit or window is rejected here so that a misconfigured
     * limiter can never be constructed.
     */
    public RateLimitPolicy {
        Objects.requireNonNull(window, "window must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
    }

    /**
     * Create a policy from a limit and a window in seconds.
     *
     * @param limit the maximum requests per window
     * @param windowSeconds the window duration in seconds
     * @return the policy
     */
    public static RateLimitPolicy of(long limit, long windowSeconds) {
        return new RateLimitPolicy(limit, Duration.ofSeconds(windowSeconds));
    }

    /**
     * Expiry applied to every piece of limiter state.
     *
     * <p>Twice the window, so that state survives clock skew between instances
     * and a dormant identity does not keep stale state forever.
     *
     * @return the state TTL
     */
    public Duration stateTtl() {
        return window.multipliedBy(2);
    }

    /**
     * Token bucket refill rate.
     *
     * @return tokens per second
     */
    public double refillRatePerSecond() {
        return (double) limit / (window.toMillis() / 1000.0);
    }
}
