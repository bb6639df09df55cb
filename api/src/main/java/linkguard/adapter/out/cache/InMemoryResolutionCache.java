package linkguard.adapter.out.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import linkguard.core.port.out.ResolutionCache;

/**
 * In-memory ResolutionCache for single-instance deployments and tests.
 *
 * <p>Backed by a bounded {@link CaffeineLocalCache} with per-entry expiry on the
 * injected clock, so codes that are never read again are still evicted.
 */
public class InMemoryResolutionCache implements ResolutionCache {

    static final Duration MAX_TTL = Duration.ofDays(7);
    static final long DEFAULT_MAX_ENTRIES = 100_000;

    private final CaffeineLocalCache<String, String> entries;

    public InMemoryResolutionCache(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public InMemoryResolutionCache(Clock clock, long maxEntries) {
        this.entries = new CaffeineLocalCache<>(MAX_TTL, maxEntries, 0.0, CaffeineLocalCache.tickerOf(clock));
    }

    @Override
    public Uni<Optional<String>> get(String shortCode) {
        return Uni.createFrom().item(() -> entries.get(shortCode));
    }

    @Override
    public Uni<Void> put(String shortCode, String originalUrl, Duration ttl) {
        return Uni.createFrom().item(() -> {
            entries.put(shortCode, originalUrl, ttl);
            return null;
        });
    }

    long size() {
        return entries.estimatedSize();
    }
}
