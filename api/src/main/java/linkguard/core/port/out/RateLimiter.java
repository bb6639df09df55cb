package linkguard.core.port.out;

import io.smallrye.mutiny.Uni;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;

/**
 * Port interface for rate limiting operations.
 *
 * <p>Each instance applies one algorithm and one policy, fixed at construction.
 * Implementations must be thread-safe and keep all state in a {@link RateLimitStore}
 * so that every instance sharing the store sees the same counters.
 */
public interface RateLimiter {

    /**
     * Check whether a request for the identity is allowed, consuming quota.
     *
     * <p>A store failure fails the returned Uni; the caller decides whether to
     * fail open.
     *
     * @param identity the identity key
     * @return the decision
     */
    Uni<RateLimitDecision> check(String identity);

    /**
     * The algorithm this limiter applies.
     *
     * @return the algorithm
     */
    RateLimitAlgorithm algorithm();

    /**
     * The policy this limiter enforces.
     *
     * @return the policy
     */
    RateLimitPolicy policy();
}
