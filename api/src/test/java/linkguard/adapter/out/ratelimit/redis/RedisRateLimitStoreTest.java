package linkguard.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import linkguard.adapter.out.storage.redis.RedisTimeoutHelper;
import linkguard.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;
import linkguard.core.port.out.Metrics;

@DisplayName("RedisRateLimitStore")
@ExtendWith(MockitoExtension.class)
class RedisRateLimitStoreTest {

    private static final Duration TTL = Duration.ofSeconds(120);

    @Mock
    private ReactiveRedisDataSource redis;

    @Mock
    private Metrics metrics;

    private RedisRateLimitStore store;

    @BeforeEach
    void setUp() {
        store = new RedisRateLimitStore(redis, new RedisTimeoutHelper(Duration.ofMillis(100), metrics, "ratelimit"));
    }

    private static Response number(long value) {
        final var response = mock(Response.class);
        when(response.toLong()).thenReturn(value);
        return response;
    }

    @Test
    @DisplayName("should run the increment script with the key and TTL in milliseconds")
    void shouldRunIncrementScript() {
        final var reply = number(3);
        when(redis.execute("EVAL", RedisRateLimitStore.INCREMENT_SCRIPT, "1", "client:1714564800000", "120000"))
                .thenReturn(Uni.createFrom().item(reply));

        assertEquals(3L, store.incrementAndExpire("client:1714564800000", TTL).await().indefinitely());
    }

    @Test
    @DisplayName("should pass window start and event timestamps to the sliding log script")
    void shouldRunSlidingLogScript() {
        final var reply = number(2);
        when(redis.execute(
                        "EVAL", RedisRateLimitStore.SLIDING_LOG_SCRIPT, "1", "client", "1000", "3000", "120000"))
                .thenReturn(Uni.createFrom().item(reply));

        assertEquals(2L, store.recordAndCount("client", 1000L, 3000L, TTL).await().indefinitely());
    }

    @Test
    @DisplayName("should decode the token bucket reply")
    void shouldDecodeTokenBucketReply() {
        final var tokens = mock(Response.class);
        when(tokens.toString()).thenReturn("4.5");
        final var lastRefill = number(1714564800L);
        final var consumed = number(1L);
        final var reply = mock(Response.class);
        when(reply.size()).thenReturn(3);
        when(reply.get(0)).thenReturn(tokens);
        when(reply.get(1)).thenReturn(lastRefill);
        when(reply.get(2)).thenReturn(consumed);
        when(redis.execute(
                        eq("EVAL"),
                        eq(RedisRateLimitStore.TOKEN_BUCKET_SCRIPT),
                        eq("2"),
                        eq("client:tokens"),
                        eq("client:last_refill"),
                        eq("10"),
                        any(String.class),
                        eq("1714564800"),
                        eq("120000")))
                .thenReturn(Uni.createFrom().item(reply));

        final var state = store.takeToken("client", 10, 0.5, 1714564800L, TTL).await().indefinitely();

        assertEquals(4.5, state.tokens(), 1e-9);
        assertEquals(1714564800L, state.lastRefillEpochSeconds());
        assertTrue(state.consumed());
    }

    @Test
    @DisplayName("should fail with a timeout when Redis does not answer")
    void shouldTimeOut() {
        when(redis.execute("EVAL", RedisRateLimitStore.INCREMENT_SCRIPT, "1", "client", "120000"))
                .thenReturn(Uni.createFrom().nothing());

        assertThrows(
                RedisTimeoutException.class,
                () -> store.incrementAndExpire("client", TTL).await().indefinitely());
        verify(metrics).recordRedisTimeout("RedisRateLimitStore", "incrementAndExpire");
    }

    @Test
    @DisplayName("should reject a null reply")
    void shouldRejectNullReply() {
        when(redis.execute("EVAL", RedisRateLimitStore.INCREMENT_SCRIPT, "1", "client", "120000"))
                .thenReturn(Uni.createFrom().nullItem());

        assertThrows(
                IllegalStateException.class,
                () -> store.incrementAndExpire("client", TTL).await().indefinitely());
    }
}
