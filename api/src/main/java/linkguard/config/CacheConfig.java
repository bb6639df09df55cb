package linkguard.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the resolution cache.
 *
 * <p>Configuration prefix: {@code linkguard.cache}
 */
@ConfigMapping(prefix = "linkguard.cache")
public interface CacheConfig {

    /**
     * Lifetime of a cached short code.
     *
     * @return the TTL (default: 24h)
     */
    @WithDefault("24h")
    Duration ttl();

    /**
     * Size bound of the in-memory shared cache, used when Redis is off.
     *
     * @return the maximum entry count (default: 100000)
     */
    @WithDefault("100000")
    long maxEntries();

    RedisCacheConfig redis();

    LocalConfig local();

    interface RedisCacheConfig {

        /**
         * Use Redis as the shared cache.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        @WithDefault("linkguard:link:")
        String keyPrefix();
    }

    /**
     * Per-instance L1 cache in front of the shared cache.
     */
    interface LocalConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * L1 lifetime, kept short so instances converge quickly.
         *
         * @return the TTL (default: 5m)
         */
        @WithDefault("5m")
        Duration ttl();

        @WithDefault("10000")
        long maxEntries();
    }
}
