package linkguard.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import linkguard.adapter.out.storage.redis.RedisTimeoutHelper;
import linkguard.core.port.out.ResolutionCache;

/**
 * Redis implementation of ResolutionCache.
 *
 * <p>Key format: {@code {prefix}{shortCode}} holding the original URL, written with
 * {@code SETEX}. Reads fail on timeout so the cascade can fall through; writes
 * never fail.
 */
public class RedisResolutionCache implements ResolutionCache {

    private final ReactiveValueCommands<String, String> valueCommands;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisResolutionCache(ReactiveRedisDataSource ds, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.valueCommands = ds.value(String.class, String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Optional<String>> get(String shortCode) {
        return timeoutHelper.withTimeout(valueCommands.get(keyFor(shortCode)).map(Optional::ofNullable), "get");
    }

    @Override
    public Uni<Void> put(String shortCode, String originalUrl, Duration ttl) {
        final var seconds = Math.max(1, ttl.toSeconds());
        return timeoutHelper.withTimeoutSilent(
                valueCommands.setex(keyFor(shortCode), seconds, originalUrl).replaceWithVoid(), "put");
    }

    String keyFor(String shortCode) {
        return keyPrefix + shortCode;
    }
}
