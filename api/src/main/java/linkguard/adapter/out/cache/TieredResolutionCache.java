package linkguard.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import linkguard.core.port.out.ResolutionCache;

/**
 * Two-tier ResolutionCache: a per-instance {@link LocalCache} in front of a
 * shared cache.
 *
 * <p>The local tier is read-through only. It is filled from shared-cache hits
 * and from writes, and never answers for a code the shared tier has not seen.
 * A write keeps the local copy no longer than the shared one; a copy filled from
 * a shared hit lives for the local default lifetime.
 * Failures of the shared tier propagate unchanged.
 */
public class TieredResolutionCache implements ResolutionCache {

    private final LocalCache<String, String> localCache;
    private final ResolutionCache sharedCache;

    public TieredResolutionCache(LocalCache<String, String> localCache, ResolutionCache sharedCache) {
        this.localCache = localCache;
        this.sharedCache = sharedCache;
    }

    @Override
    public Uni<Optional<String>> get(String shortCode) {
        final var local = localCache.get(shortCode);
        if (local.isPresent()) {
            return Uni.createFrom().item(local);
        }
        return sharedCache.get(shortCode).invoke(found -> found.ifPresent(url -> localCache.put(shortCode, url)));
    }

    @Override
    public Uni<Void> put(String shortCode, String originalUrl, Duration ttl) {
        localCache.put(shortCode, originalUrl, ttl);
        return sharedCache.put(shortCode, originalUrl, ttl);
    }
}
