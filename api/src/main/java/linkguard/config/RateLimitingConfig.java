package linkguard.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import linkguard.core.model.ratelimit.IdentityKeyType;
import linkguard.core.model.ratelimit.RateLimitAlgorithm;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code linkguard.rate-limiting}
 *
 * <p>Read once at startup; changing it requires a restart.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code LINKGUARD_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code LINKGUARD_RATE_LIMITING_ALGORITHM} - FIXED_WINDOW, SLIDING_WINDOW, TOKEN_BUCKET</li>
 *   <li>{@code LINKGUARD_RATE_LIMITING_LIMIT} - Requests per window</li>
 *   <li>{@code LINKGUARD_RATE_LIMITING_WINDOW} - Window duration, e.g. {@code 60s}</li>
 * </ul>
 */
@ConfigMapping(prefix = "linkguard.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Algorithm of the global limiter.
     *
     * @return the algorithm (default: TOKEN_BUCKET)
     */
    @WithDefault("TOKEN_BUCKET")
    RateLimitAlgorithm algorithm();

    /**
     * Requests per window (token bucket capacity).
     *
     * @return the limit (default: 100)
     */
    @WithDefault("100")
    long limit();

    /**
     * Window duration.
     *
     * @return the window (default: 60s)
     */
    @WithDefault("60s")
    Duration window();

    /**
     * How the identity key is derived from a request.
     *
     * @return the key strategy (default: CALLER_AND_TARGET)
     */
    @WithDefault("CALLER_AND_TARGET")
    IdentityKeyType keyStrategy();

    /**
     * Prefix of every identity key, allowing several applications to share a store.
     *
     * @return key prefix (default: "linkguard:ratelimit:")
     */
    @WithDefault("linkguard:ratelimit:")
    String keyPrefix();

    /**
     * Include X-RateLimit-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Path prefixes that bypass rate limiting entirely.
     *
     * @return skip paths (default: /health, /metrics, /q/)
     */
    @WithDefault("/health,/metrics,/q/")
    List<String> skipPaths();

    /**
     * Redis backend configuration.
     */
    RedisBackendConfig redis();

    /**
     * Additional limiters applied after the global one to matching endpoints.
     *
     * @return endpoint limiters by name
     */
    Map<String, EndpointConfig> endpoints();

    /**
     * Redis-specific rate limiting configuration.
     */
    interface RedisBackendConfig {

        /**
         * Enable Redis as the rate limiting backend.
         *
         * <p>When enabled and a Redis data source is available, Redis holds
         * all limiter state. Otherwise the in-memory store is used.
         *
         * @return true to use Redis backend (default: false)
         */
        @WithDefault("false")
        boolean enabled();
    }

    /**
     * A per-endpoint limiter.
     */
    interface EndpointConfig {

        /**
         * Path the limiter applies to. A trailing {@code *} matches any suffix.
         *
         * @return the path pattern
         */
        String path();

        /**
         * HTTP method the limiter applies to; any method when absent.
         *
         * @return the method
         */
        Optional<String> method();

        @WithDefault("SLIDING_WINDOW")
        RateLimitAlgorithm algorithm();

        long limit();

        Duration window();
    }
}
