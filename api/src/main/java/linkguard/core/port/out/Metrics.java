package linkguard.core.port.out;

import linkguard.core.model.ratelimit.RateLimitAlgorithm;

/**
 * Port interface for recording service metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Record a rate limit decision.
     *
     * @param algorithm the limiter algorithm
     * @param allowed whether the request was admitted
     */
    void recordRateLimitDecision(RateLimitAlgorithm algorithm, boolean allowed);

    /**
     * Record a rate limit check that failed open because the store errored.
     *
     * @param algorithm the limiter algorithm
     */
    void recordRateLimitFailOpen(RateLimitAlgorithm algorithm);

    /**
     * Record which layer answered a resolution.
     *
     * @param layer one of {@code filter}, {@code cache}, {@code store}
     * @param found whether the code resolved
     */
    void recordResolution(String layer, boolean found);

    void recordCacheFailure(String operation);

    void recordVisitDropped();

    void recordRedisTimeout(String repository, String operation);

    void recordRedisFailure(String repository, String operation);
}
