package linkguard.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for short link creation.
 *
 * <p>Configuration prefix: {@code linkguard.links}
 */
@ConfigMapping(prefix = "linkguard.links")
public interface LinkConfig {

    /**
     * Base URL prepended to short codes in responses.
     *
     * @return base URL (default: http://localhost:8080)
     */
    @WithDefault("http://localhost:8080")
    String baseUrl();

    /**
     * Snowflake datacenter ID, 0..31.
     *
     * @return datacenter ID (default: 1)
     */
    @WithDefault("1")
    long datacenterId();

    /**
     * Snowflake worker ID, 0..31. Must be unique per instance within a datacenter.
     *
     * @return worker ID (default: 1)
     */
    @WithDefault("1")
    long workerId();

    /**
     * Regenerations allowed when a generated code already exists.
     *
     * @return retries (default: 3)
     */
    @WithDefault("3")
    int collisionRetries();
}
