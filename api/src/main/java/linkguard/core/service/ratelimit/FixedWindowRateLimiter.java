package linkguard.core.service.ratelimit;

import java.time.Clock;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.core.port.out.RateLimitStore;
import linkguard.core.port.out.RateLimiter;

/**
 * Fixed window counter.
 *
 * <p>Time is cut into buckets of one window each. Every request increments the
 * counter for {@code identity:bucketStartEpochMillis}; the counter expires after
 * two windows. Millisecond keys keep sub-second windows in separate buckets, and
 * the reset time is rounded up to the next whole second. A burst straddling a bucket boundary can be admitted up to twice
 * the limit, which is inherent to the algorithm.
 */
public final class FixedWindowRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(FixedWindowRateLimiter.class);

    private final RateLimitStore store;
    private final RateLimitPolicy policy;
    private final Clock clock;

    public FixedWindowRateLimiter(RateLimitStore store, RateLimitPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> check(String identity) {
        final var nowMillis = clock.millis();
        final var windowMillis = policy.window().toMillis();
        final var bucketStartMillis = nowMillis - Math.floorMod(nowMillis, windowMillis);
        final var key = identity + ":" + bucketStartMillis;
        final var resetAt = Instant.ofEpochSecond(Math.floorDiv(bucketStartMillis + windowMillis + 999, 1000));

        return store.incrementAndExpire(key, policy.stateTtl()).map(count -> {
            final var limit = policy.limit();
            final var remaining = Math.max(0, limit - count);
            if (count <= limit) {
                return RateLimitDecision.allow(remaining, limit, resetAt);
            }
            LOG.debugf("Fixed window exhausted for %s: count=%d, limit=%d", identity, count, limit);
            return RateLimitDecision.rejected(remaining, limit, resetAt);
        });
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.FIXED_WINDOW;
    }

    @Override
    public RateLimitPolicy policy() {
        return policy;
    }
}
