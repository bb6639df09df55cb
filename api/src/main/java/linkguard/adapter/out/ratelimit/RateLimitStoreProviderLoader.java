package linkguard.adapter.out.ratelimit;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import linkguard.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import linkguard.adapter.out.ratelimit.memory.InMemoryRateLimitStoreProvider;
import linkguard.adapter.out.ratelimit.redis.RedisRateLimitStoreProvider;
import linkguard.adapter.out.storage.redis.RedisTimeoutHelper;
import linkguard.config.RateLimitingConfig;
import linkguard.config.RedisConfig;
import linkguard.core.port.out.Metrics;
import linkguard.core.port.out.RateLimitStore;
import linkguard.spi.RateLimitStoreProvider;

/**
 * CDI producer for the rate limit store.
 *
 * <p>Selects the store implementation based on configuration and availability:
 * <ul>
 *   <li>Redis (priority 10) - Used when enabled and a data source is available</li>
 *   <li>In-memory (priority 0) - Fallback, always available</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimitStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimitStoreProviderLoader.class);

    private final RateLimitingConfig config;
    private final RedisConfig redisConfig;
    private final Metrics metrics;
    private final Clock clock;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public RateLimitStoreProviderLoader(
            RateLimitingConfig config,
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

    /**
     * Produces the rate limit store for CDI injection.
     *
     * @return the configured store
     */
    @Produces
    @ApplicationScoped
    public RateLimitStore produceRateLimitStore() {
        final var redisProvider = createRedisProvider();
        if (redisProvider.isPresent() && redisProvider.get().isAvailable()) {
            LOG.infov("Using rate limit store provider: {0}", redisProvider.get().name());
            return redisProvider.get().createStore();
        }

        final var inMemoryProvider = new InMemoryRateLimitStoreProvider(clock);
        LOG.infov("Using rate limit store provider: {0}", inMemoryProvider.name());
        return inMemoryProvider.createStore();
    }

    /**
     * Disposes the store, shutting down any cleanup executors.
     */
    void disposeRateLimitStore(@Disposes RateLimitStore store) {
        if (store instanceof InMemoryRateLimitStore inMemory) {
            inMemory.shutdown();
        }
    }

    private Optional<RateLimitStoreProvider> createRedisProvider() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis rate limiting not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis rate limiting enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var timeoutHelper =
                    new RedisTimeoutHelper(redisConfig.operationTimeout(), metrics, "ratelimit");
            return Optional.of(new RedisRateLimitStoreProvider(redisDataSource.get(), timeoutHelper));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis rate limit store, falling back to in-memory");
            return Optional.empty();
        }
    }
}
