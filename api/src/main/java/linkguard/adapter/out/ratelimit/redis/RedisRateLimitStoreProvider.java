package linkguard.adapter.out.ratelimit.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import linkguard.adapter.out.storage.redis.RedisTimeoutHelper;
import linkguard.core.port.out.RateLimitStore;
import linkguard.spi.RateLimitStoreProvider;

/**
 * Redis-based store provider for multi-instance deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected when Redis is enabled for rate limiting and a data source exists.
 */
public final class RedisRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisRateLimitStoreProvider(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public RateLimitStore createStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source not available");
        }
        return new RedisRateLimitStore(redisDataSource, timeoutHelper);
    }
}
