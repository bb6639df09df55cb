package linkguard.spi;

import linkguard.core.port.out.RateLimitStore;

/**
 * Service Provider Interface for rate limit store implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * selected based on priority. Higher priority providers are preferred.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Default, single-instance only</li>
 *   <li>Redis (priority 10) - Shared across instances, recommended for production</li>
 * </ul>
 *
 * <p>To create a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Register in {@code META-INF/services/linkguard.spi.RateLimitStoreProvider}</li>
 *   <li>Return appropriate priority</li>
 * </ol>
 */
public interface RateLimitStoreProvider {

    /**
     * Return the priority of this provider.
     *
     * <p>Standard priorities:
     * <ul>
     *   <li>0 - In-memory (fallback)</li>
     *   <li>10 - Redis (production default)</li>
     *   <li>100+ - Custom implementations</li>
     * </ul>
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the store. Called once during application startup.
     *
     * @return a thread-safe store
     */
    RateLimitStore createStore();
}
