package linkguard.core.model.ratelimit;

/**
 * Rate limiting algorithms supported by the admission controller.
 *
 * <p>The algorithm is selected once per limiter at construction time and never
 * switched at request time.
 */
public enum RateLimitAlgorithm {

    /**
     * Fixed window counter.
     *
     * <p>Counts requests within fixed time buckets with a hard cutoff at bucket
     * boundaries. Simple and cheap, but up to twice the limit can be admitted in
     * a span straddling two adjacent buckets.
     */
    FIXED_WINDOW,

    /**
     * Sliding window log.
     *
     * <p>Keeps one timestamp per request and counts the entries inside the
     * trailing window. Precise, at the cost of memory proportional to the limit.
     */
    SLIDING_WINDOW,

    /**
     * Token bucket (default).
     *
     * <p>Allows bursts up to the bucket capacity while refilling at a steady
     * rate of {@code limit / window} tokens per second.
     */
    TOKEN_BUCKET
}
