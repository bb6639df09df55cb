package linkguard.core.service.ratelimit;

import java.time.Clock;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.core.port.out.RateLimitStore;
import linkguard.core.port.out.RateLimiter;

/**
 * Builds a limiter for a configured algorithm.
 *
 * <p>The algorithm is resolved here once; limiters never branch on it per request.
 */
public final class RateLimiterFactory {

    private final RateLimitStore store;
    private final Clock clock;

    public RateLimiterFactory(RateLimitStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public RateLimiter create(RateLimitAlgorithm algorithm, RateLimitPolicy policy) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm must not be null");
        }
        return switch (algorithm) {
            case FIXED_WINDOW -> new FixedWindowRateLimiter(store, policy, clock);
            case SLIDING_WINDOW -> new SlidingWindowLogRateLimiter(store, policy, clock);
            case TOKEN_BUCKET -> new TokenBucketRateLimiter(store, policy, clock);
        };
    }
}
