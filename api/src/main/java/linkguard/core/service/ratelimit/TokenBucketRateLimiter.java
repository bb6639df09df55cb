package linkguard.core.service.ratelimit;

import java.time.Clock;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.core.model.ratelimit.TokenBucketState;
import linkguard.core.port.out.RateLimitStore;
import linkguard.core.port.out.RateLimiter;

/**
 * Token bucket.
 *
 * <p>The bucket holds up to {@code limit} tokens and refills at
 * {@code limit / window} tokens per second, measured in whole elapsed seconds.
 * A request takes one token. The refill and take run as one atomic store step.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(TokenBucketRateLimiter.class);

    private final RateLimitStore store;
    private final RateLimitPolicy policy;
    private final Clock clock;

    public TokenBucketRateLimiter(RateLimitStore store, RateLimitPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> check(String identity) {
        final var nowSeconds = clock.instant().getEpochSecond();
        final var rate = policy.refillRatePerSecond();

        return store.takeToken(identity, policy.limit(), rate, nowSeconds, policy.stateTtl())
                .map(state -> toDecision(identity, state, nowSeconds, rate));
    }

    private RateLimitDecision toDecision(String identity, TokenBucketState state, long nowSeconds, double rate) {
        final var tokens = state.tokens();
        final var remaining = (long) Math.floor(tokens);
        final var resetAt = tokens >= 1.0
                ? Instant.ofEpochSecond(nowSeconds)
                : Instant.ofEpochSecond(nowSeconds + (long) Math.ceil((1.0 - tokens) / rate));

        if (state.consumed()) {
            return RateLimitDecision.allow(remaining, policy.limit(), resetAt);
        }
        LOG.debugf("Token bucket empty for %s: tokens=%.3f", identity, tokens);
        return RateLimitDecision.rejected(remaining, policy.limit(), resetAt);
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.TOKEN_BUCKET;
    }

    @Override
    public RateLimitPolicy policy() {
        return policy;
    }
}
