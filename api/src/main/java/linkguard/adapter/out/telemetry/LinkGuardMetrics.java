package linkguard.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.port.out.Metrics;

/**
 * Records service metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code linkguard.ratelimit.decisions.total} - Limiter decisions by algorithm and outcome</li>
 *   <li>{@code linkguard.ratelimit.failopen.total} - Checks admitted because the store failed</li>
 *   <li>{@code linkguard.resolutions.total} - Resolutions by answering layer and outcome</li>
 *   <li>{@code linkguard.cache.failures.total} - Cache read/write failures</li>
 *   <li>{@code linkguard.visits.dropped.total} - Visits dropped on a saturated queue</li>
 *   <li>{@code linkguard.redis.timeouts.total} - Redis operations over their deadline</li>
 *   <li>{@code linkguard.redis.failures.total} - Redis operations that failed</li>
 * </ul>
 */
@ApplicationScoped
public class LinkGuardMetrics implements Metrics {

    private final MeterRegistry registry;

    @Inject
    public LinkGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRateLimitDecision(RateLimitAlgorithm algorithm, boolean allowed) {
        Counter.builder("linkguard.ratelimit.decisions.total")
                .description("Rate limit decisions")
                .tag("algorithm", tagValue(algorithm))
                .tag("outcome", allowed ? "allowed" : "denied")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitFailOpen(RateLimitAlgorithm algorithm) {
        Counter.builder("linkguard.ratelimit.failopen.total")
                .description("Rate limit checks admitted because the store failed")
                .tag("algorithm", tagValue(algorithm))
                .register(registry)
                .increment();
    }

    @Override
    public void recordResolution(String layer, boolean found) {
        Counter.builder("linkguard.resolutions.total")
                .description("Short code resolutions by answering layer")
                .tag("layer", layer)
                .tag("found", String.valueOf(found))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheFailure(String operation) {
        Counter.builder("linkguard.cache.failures.total")
                .description("Resolution cache failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordVisitDropped() {
        Counter.builder("linkguard.visits.dropped.total")
                .description("Visits dropped because the queue was full")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisTimeout(String repository, String operation) {
        Counter.builder("linkguard.redis.timeouts.total")
                .description("Redis operations that exceeded their deadline")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisFailure(String repository, String operation) {
        Counter.builder("linkguard.redis.failures.total")
                .description("Redis operations that failed")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    private static String tagValue(RateLimitAlgorithm algorithm) {
        return algorithm != null ? algorithm.name().toLowerCase(Locale.ROOT) : "unknown";
    }
}
