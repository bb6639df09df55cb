package linkguard.adapter.out.cache;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import linkguard.adapter.out.storage.redis.RedisTimeoutHelper;
import linkguard.config.CacheConfig;
import linkguard.config.RedisConfig;
import linkguard.core.port.out.Metrics;
import linkguard.core.port.out.ResolutionCache;

/**
 * CDI producer for the resolution cache.
 *
 * <p>The shared tier is Redis when enabled and available, in-memory otherwise.
 * A Caffeine L1 is layered in front when {@code linkguard.cache.local.enabled}.
 */
@ApplicationScoped
public class ResolutionCacheProducer {

    private static final Logger LOG = Logger.getLogger(ResolutionCacheProducer.class);

    private final CacheConfig config;
    private final RedisConfig redisConfig;
    private final Metrics metrics;
    private final Clock clock;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public ResolutionCacheProducer(
            CacheConfig config,
            RedisConfig redisConfig,
            Metrics metrics,
            Clock clock,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.redisConfig = redisConfig;
        this.metrics = metrics;
        this.clock = clock;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public ResolutionCache resolutionCache() {
        final var shared = sharedCache();
        final var local = config.local();
        if (!local.enabled()) {
            return shared;
        }
        LOG.infov("Local resolution cache enabled (ttl={0}, maxEntries={1})", local.ttl(), local.maxEntries());
        return new TieredResolutionCache(new CaffeineLocalCache<>(local.ttl(), local.maxEntries()), shared);
    }

    private ResolutionCache sharedCache() {
        if (config.redis().enabled()) {
            if (redisDataSource.isResolvable()) {
                LOG.info("Using Redis resolution cache");
                final var timeoutHelper = new RedisTimeoutHelper(redisConfig.operationTimeout(), metrics, "cache");
                return new RedisResolutionCache(redisDataSource.get(), config.redis().keyPrefix(), timeoutHelper);
            }
            LOG.warn("Redis cache enabled but ReactiveRedisDataSource not available, using in-memory cache");
        }
        LOG.info("Using in-memory resolution cache");
        return new InMemoryResolutionCache(clock, config.maxEntries());
    }
}
