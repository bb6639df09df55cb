package linkguard.adapter.out.ratelimit.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import linkguard.adapter.out.storage.redis.RedisTimeoutHelper;
import linkguard.core.model.ratelimit.TokenBucketState;
import linkguard.core.port.out.RateLimitStore;

/**
 * Redis-backed rate limit store for multi-instance deployments.
 *
 * <p>Each primitive is a single Lua script executed through {@code EVAL}, so
 * concurrent checks from any number of instances are applied atomically.
 * Every call is bounded by {@link RedisTimeoutHelper#withTimeout}; a timeout or
 * transport error fails the Uni.
 *
 * <p>Key shapes:
 * <ul>
 *   <li>fixed window: {@code {identity}:{bucketStartEpochMillis}} (string counter)</li>
 *   <li>sliding window: {@code {identity}} (sorted set of epoch nanoseconds)</li>
 *   <li>token bucket: {@code {identity}:tokens} and {@code {identity}:last_refill}</li>
 * </ul>
 */
public final class RedisRateLimitStore implements RateLimitStore {

    /**
     * KEYS[1] counter key; ARGV[1] TTL in milliseconds. Returns the new count.
     */
    static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            redis.call('PEXPIRE', KEYS[1], ARGV[1])
            return count
            """;

    /**
     * KEYS[1] log key; ARGV[1] window start (exclusive lower bound kept);
     * ARGV[2] event timestamp; ARGV[3] TTL in milliseconds. Returns the cardinality.
     *
     * <p>Scores are doubles and lose sub-microsecond precision; members stay exact,
     * so distinct events never collapse.
     */
    static final String SLIDING_LOG_SCRIPT =
            """
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[1])
            redis.call('ZADD', KEYS[1], ARGV[2], ARGV[2])
            local count = redis.call('ZCARD', KEYS[1])
            redis.call('PEXPIRE', KEYS[1], ARGV[3])
            return count
            """;

    /**
     * KEYS[1] tokens key; KEYS[2] last refill key; ARGV[1] capacity; ARGV[2] refill
     * rate per second; ARGV[3] now in epoch seconds; ARGV[4] TTL in milliseconds.
     *
     * <p>Returns [tokens (string), last_refill, consumed (0/1)].
     */
    static final String TOKEN_BUCKET_SCRIPT =
            """
            local capacity = tonumber(ARGV[1])
            local rate = tonumber(ARGV[2])
            local now = tonumber(ARGV[3])
            local ttl_ms = tonumber(ARGV[4])

            local tokens = tonumber(redis.call('GET', KEYS[1]))
            local last_refill = tonumber(redis.call('GET', KEYS[2]))
            if tokens == nil then
                tokens = capacity
            end
            if last_refill == nil then
                last_refill = now
            end

            local elapsed = math.max(0, now - last_refill)
            tokens = math.min(capacity, tokens + elapsed * rate)

            local consumed = 0
            if tokens >= 1 then
                tokens = tokens - 1
                consumed = 1
            end

            redis.call('SET', KEYS[1], tostring(tokens), 'PX', ttl_ms)
            redis.call('SET', KEYS[2], tostring(now), 'PX', ttl_ms)
            return {tostring(tokens), now, consumed}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisRateLimitStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Long> incrementAndExpire(String key, Duration ttl) {
        final var operation = redisDataSource
                .execute("EVAL", INCREMENT_SCRIPT, "1", key, String.valueOf(ttl.toMillis()))
                .map(RedisRateLimitStore::toLong);
        return timeoutHelper.withTimeout(operation, "incrementAndExpire");
    }

    @Override
    public Uni<Long> recordAndCount(String key, long windowStartNanos, long eventNanos, Duration ttl) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        SLIDING_LOG_SCRIPT,
                        "1", // numkeys
                        key,
                        String.valueOf(windowStartNanos),
                        String.valueOf(eventNanos),
                        String.valueOf(ttl.toMillis()))
                .map(RedisRateLimitStore::toLong);
        return timeoutHelper.withTimeout(operation, "recordAndCount");
    }

    @Override
    public Uni<TokenBucketState> takeToken(
            String key, long capacity, double refillRatePerSecond, long nowEpochSeconds, Duration ttl) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        TOKEN_BUCKET_SCRIPT,
                        "2", // numkeys
                        key + ":tokens",
                        key + ":last_refill",
                        String.valueOf(capacity),
                        String.valueOf(refillRatePerSecond),
                        String.valueOf(nowEpochSeconds),
                        String.valueOf(ttl.toMillis()))
                .map(RedisRateLimitStore::toBucketState);
        return timeoutHelper.withTimeout(operation, "takeToken");
    }

    private static long toLong(Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from Redis");
        }
        return response.toLong();
    }

    private static TokenBucketState toBucketState(Response response) {
        if (response == null || response.size() < 3) {
            throw new IllegalStateException("Unexpected token bucket response from Redis: " + response);
        }
        final var tokens = Double.parseDouble(response.get(0).toString());
        final var lastRefill = response.get(1).toLong();
        final var consumed = response.get(2).toLong() == 1L;
        return new TokenBucketState(tokens, lastRefill, consumed);
    }
}
