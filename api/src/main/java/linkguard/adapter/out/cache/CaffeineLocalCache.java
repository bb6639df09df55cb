package linkguard.adapter.out.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Bounded Caffeine cache whose entries expire individually.
 *
 * <p>Every entry lives for the cache's default lifetime, shortened by a random
 * jitter so that instances filled at the same moment do not all miss together.
 * A caller may ask for a shorter lifetime per entry (a link expiring soon); it is
 * never extended past the jittered default. Expired entries are evicted by Caffeine
 * itself, whether or not they are read again.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final Cache<K, Timed<V>> cache;
    private final long defaultTtlNanos;
    private final double jitterFactor;

    public CaffeineLocalCache(Duration defaultTtl, long maxEntries) {
        this(defaultTtl, maxEntries, DEFAULT_JITTER_FACTOR);
    }

    public CaffeineLocalCache(Duration defaultTtl, long maxEntries, double jitterFactor) {
        this(defaultTtl, maxEntries, jitterFactor, Ticker.systemTicker());
    }

    /**
     * @param defaultTtl   lifetime of an entry stored without an explicit TTL, and the cap for all others
     * @param maxEntries   size bound; least valuable entries are evicted beyond it
     * @param jitterFactor fraction (0 to 0.5) by which the default lifetime is randomly shortened
     * @param ticker       time source for expiry
     */
    public CaffeineLocalCache(Duration defaultTtl, long maxEntries, double jitterFactor, Ticker ticker) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Default TTL must be positive, got: " + defaultTtl);
        }
        this.defaultTtlNanos = defaultTtl.toNanos();
        this.jitterFactor = jitterFactor;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(ticker)
                .expireAfter(new PerEntryExpiry<K, V>())
                .build();
    }

    /**
     * Ticker reading a {@link Clock}, so expiry follows an injected clock.
     */
    public static Ticker tickerOf(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(Timed::value);
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, new Timed<>(value, jitteredDefaultNanos()));
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        final var ttlNanos = Math.min(ttl.toNanos(), jitteredDefaultNanos());
        if (ttlNanos <= 0) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Timed<>(value, ttlNanos));
    }

    @Override
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private long jitteredDefaultNanos() {
        if (jitterFactor == 0.0) {
            return defaultTtlNanos;
        }
        final var shortening = ThreadLocalRandom.current().nextDouble() * jitterFactor;
        return (long) (defaultTtlNanos * (1.0 - shortening));
    }

    private record Timed<V>(V value, long ttlNanos) {}

    private static final class PerEntryExpiry<K, V> implements Expiry<K, Timed<V>> {

        @Override
        public long expireAfterCreate(K key, Timed<V> entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(K key, Timed<V> entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(K key, Timed<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
