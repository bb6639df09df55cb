package linkguard.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.ratelimit.TokenBucketState;
import linkguard.core.port.out.RateLimitStore;

/**
 * In-memory rate limit store.
 *
 * <p>Each primitive runs inside {@link ConcurrentMap#compute}, which serializes
 * concurrent updates to the same key. Suitable for single-instance deployments
 * or development/testing.
 *
 * <p>Limitations:
 * <ul>
 *   <li>State is not shared across instances</li>
 *   <li>State is lost on restart</li>
 * </ul>
 *
 * <p>Expired entries are treated as absent on access and purged periodically by a
 * daemon cleanup thread. Call {@link #shutdown()} when the store is disposed.
 */
public final class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimitStore.class);

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EventLog> logs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    /**
     * Creates a store with a periodic cleanup task.
     *
     * @param clock time source for expiry
     * @param cleanupInterval how often expired entries are purged
     */
    public InMemoryRateLimitStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            final var thread = new Thread(r, "linkguard-ratelimit-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        final var intervalMillis = cleanupInterval.toMillis();
        cleanupExecutor.scheduleAtFixedRate(
                this::purgeExpired, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public Uni<Long> incrementAndExpire(String key, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var updated = counters.compute(key, (k, current) -> {
                final var count = current == null || current.isExpired(now) ? 1L : current.count() + 1;
                return new Counter(count, now + ttl.toMillis());
            });
            return updated.count();
        });
    }

    @Override
    public Uni<Long> recordAndCount(String key, long windowStartNanos, long eventNanos, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var result = new long[1];
            logs.compute(key, (k, current) -> {
                final var log = current == null || current.isExpired(now) ? new EventLog() : current;
                log.events.headSet(windowStartNanos, false).clear();
                log.events.add(eventNanos);
                log.expiresAtMillis = now + ttl.toMillis();
                result[0] = log.events.size();
                return log;
            });
            return result[0];
        });
    }

    @Override
    public Uni<TokenBucketState> takeToken(
            String key, long capacity, double refillRatePerSecond, long nowEpochSeconds, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var updated = buckets.compute(key, (k, current) -> {
                final var previous = current == null || current.isExpired(now) ? null : current.state();
                final var next =
                        TokenBucketState.refillAndTake(previous, capacity, refillRatePerSecond, nowEpochSeconds);
                return new Bucket(next, now + ttl.toMillis());
            });
            return updated.state();
        });
    }

    /**
     * Remove every expired entry.
     */
    public void purgeExpired() {
        final var now = clock.millis();
        counters.values().removeIf(entry -> entry.isExpired(now));
        logs.values().removeIf(entry -> entry.isExpired(now));
        buckets.values().removeIf(entry -> entry.isExpired(now));
    }

    /**
     * Returns the number of live keys across all primitives.
     *
     * <p>Useful for monitoring and testing.
     *
     * @return the number of tracked keys
     */
    public int keyCount() {
        return counters.size() + logs.size() + buckets.size();
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("In-memory rate limit store shut down");
    }

    private record Counter(long count, long expiresAtMillis) {
        boolean isExpired(long now) {
            return now >= expiresAtMillis;
        }
    }

    private record Bucket(TokenBucketState state, long expiresAtMillis) {
        boolean isExpired(long now) {
            return now >= expiresAtMillis;
        }
    }

    // Mutated only inside compute() for its key.
    private static final class EventLog {
        private final TreeSet<Long> events = new TreeSet<>();
        private long expiresAtMillis;

        boolean isExpired(long now) {
            return now >= expiresAtMillis;
        }
    }
}
