package linkguard.spi;

import linkguard.core.port.out.LinkRepository;

/**
 * Service Provider Interface for durable short link storage.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/linkguard.spi.LinkStorageProvider}. The available
 * provider with the highest priority wins. The built-in in-memory provider has
 * priority 0.
 */
public interface LinkStorageProvider {

    int priority();

    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the repository. Called once during application startup.
     *
     * @return the repository
     */
    LinkRepository createRepository();
}
