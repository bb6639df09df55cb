package linkguard.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Time-bounded short code to URL cache in front of the durable store.
 */
public interface ResolutionCache {

    /**
     * Look up a cached URL.
     *
     * <p>A transport error fails the Uni; the cascade treats it as a miss.
     *
     * @param shortCode the short code
     * @return the cached URL if present
     */
    Uni<Optional<String>> get(String shortCode);

    /**
     * Cache a URL. Write failures are logged and suppressed.
     *
     * @param shortCode the short code
     * @param originalUrl the URL
     * @param ttl entry lifetime
     * @return completion
     */
    Uni<Void> put(String shortCode, String originalUrl, Duration ttl);
}
