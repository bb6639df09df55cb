package linkguard.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for asynchronous visit recording.
 *
 * <p>Configuration prefix: {@code linkguard.visits}
 */
@ConfigMapping(prefix = "linkguard.visits")
public interface VisitConfig {

    /**
     * Visits queued before new ones are dropped.
     *
     * @return capacity (default: 10000)
     */
    @WithDefault("10000")
    int queueCapacity();

    @WithDefault("2")
    int workers();

    /**
     * Deadline for recording one visit.
     *
     * @return timeout (default: 5s)
     */
    @WithDefault("5s")
    Duration writeTimeout();

    /**
     * How long shutdown waits for queued visits.
     *
     * @return timeout (default: 10s)
     */
    @WithDefault("10s")
    Duration shutdownTimeout();
}
