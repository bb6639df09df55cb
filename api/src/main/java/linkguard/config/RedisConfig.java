package linkguard.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for Redis access.
 *
 * <p>Configuration prefix: {@code linkguard.redis}
 */
@ConfigMapping(prefix = "linkguard.redis")
public interface RedisConfig {

    /**
     * Deadline for a single Redis operation. There is no retry.
     *
     * @return the timeout (default: 250ms)
     */
    @WithDefault("250ms")
    Duration operationTimeout();
}
