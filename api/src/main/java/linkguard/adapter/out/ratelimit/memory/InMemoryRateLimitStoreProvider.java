package linkguard.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;

import linkguard.core.port.out.RateLimitStore;
import linkguard.spi.RateLimitStoreProvider;

/**
 * In-memory store provider.
 *
 * <p>Lowest priority (0), always available. Used when Redis is not enabled.
 */
public final class InMemoryRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";
    private static final Duration CLEANUP_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;

    public InMemoryRateLimitStoreProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public RateLimitStore createStore() {
        return new InMemoryRateLimitStore(clock, CLEANUP_INTERVAL);
    }
}
