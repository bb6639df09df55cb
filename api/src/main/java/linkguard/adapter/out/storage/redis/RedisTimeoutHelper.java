package linkguard.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.port.out.Metrics;

/**
 * Puts a deadline on every Redis round trip made by the rate limit store and the
 * shared resolution cache.
 *
 * <p>Rate limit checks and L2 cache reads use {@link #withTimeout}: a slow Redis
 * surfaces as {@link RedisTimeoutException} and the admission service or cascade
 * chooses whether to fail open or fall through to the link store. L2 cache writes
 * use {@link #withTimeoutSilent}, since a lost cache entry only costs a later store
 * read. Nothing is retried.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String component;

    /**
     * @param timeout deadline per round trip, from {@code linkguard.redis.operation-timeout}
     * @param metrics timeout and failure counters, may be null
     * @param component {@code ratelimit} or {@code cache}; tags the counters and log lines
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String component) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.component = component;
    }

    /**
     * Fail with {@link RedisTimeoutException} once the deadline passes. Errors raised
     * by Redis itself reach the caller untouched.
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String command) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("{0} Redis call {1} exceeded {2}", component, command, timeout);
            countTimeout(command);
            return new RedisTimeoutException(command, component);
        });
    }

    /**
     * Complete normally whatever happens; timeouts and errors are only logged and counted.
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String command) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("{0} Redis call {1} exceeded {2}, result dropped", component, command, timeout);
                    countTimeout(command);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("{0} Redis call {1} failed, result dropped: {2}", component, command, error.getMessage());
                    countFailure(command);
                    return null;
                });
    }

    private void countTimeout(String command) {
        if (metrics != null) {
            metrics.recordRedisTimeout(component, command);
        }
    }

    private void countFailure(String command) {
        if (metrics != null) {
            metrics.recordRedisFailure(component, command);
        }
    }

    /**
     * A Redis call did not answer within its deadline.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String command;
        private final String component;

        public RedisTimeoutException(String command, String component) {
            super(component + " Redis call " + command + " timed out");
            this.command = command;
            this.component = component;
        }

        public String getCommand() {
            return command;
        }

        public String getComponent() {
            return component;
        }
    }
}
