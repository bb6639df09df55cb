package linkguard.core.service.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.core.port.out.RateLimitStore;
import linkguard.core.port.out.RateLimiter;

/**
 * Sliding window log.
 *
 * <p>Every request, admitted or not, is recorded as one entry in a per-identity
 * log scored by its epoch-nanosecond timestamp. Entries older than one window
 * are purged before counting. Timestamps handed out by one limiter are strictly
 * increasing, so two calls in the same clock tick never collapse into one entry.
 *
 * <p>The reset time is approximated as {@code now + window}; the exact reset is
 * when the oldest retained entry ages out.
 */
public final class SlidingWindowLogRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(SlidingWindowLogRateLimiter.class);

    private final RateLimitStore store;
    private final RateLimitPolicy policy;
    private final Clock clock;
    private final AtomicLong lastEventNanos = new AtomicLong(Long.MIN_VALUE);

    public SlidingWindowLogRateLimiter(RateLimitStore store, RateLimitPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> check(String identity) {
        final var now = clock.instant();
        final var eventNanos = nextEventNanos(now);
        final var windowStartNanos = toEpochNanos(now) - policy.window().toNanos();
        final var resetAt = Instant.ofEpochSecond(now.plus(policy.window()).getEpochSecond());

        return store.recordAndCount(identity, windowStartNanos, eventNanos, policy.stateTtl())
                .map(count -> {
                    final var limit = policy.limit();
                    final var remaining = Math.max(0, limit - count);
                    if (count <= limit) {
                        return RateLimitDecision.allow(remaining, limit, resetAt);
                    }
                    LOG.debugf("Sliding window full for %s: count=%d, limit=%d", identity, count, limit);
                    return RateLimitDecision.rejected(remaining, limit, resetAt);
                });
    }

    private long nextEventNanos(Instant now) {
        final var candidate = toEpochNanos(now);
        return lastEventNanos.accumulateAndGet(candidate, (previous, next) -> Math.max(next, previous + 1));
    }

    private static long toEpochNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.SLIDING_WINDOW;
    }

    @Override
    public RateLimitPolicy policy() {
        return policy;
    }
}
