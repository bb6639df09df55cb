package linkguard.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import linkguard.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.support.MutableClock;

@DisplayName("TokenBucketRateLimiter")
class TokenBucketRateLimiterTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryRateLimitStore(clock, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private RateLimitDecision check(TokenBucketRateLimiter limiter) {
        return limiter.check("client").await().indefinitely();
    }

    @Nested
    @DisplayName("Burst")
    class BurstTests {

        @Test
        @DisplayName("should admit exactly the capacity from a full bucket")
        void shouldAdmitExactlyCapacity() {
            final var limiter = new TokenBucketRateLimiter(store, RateLimitPolicy.of(5, 5), clock);

            for (var i = 0; i < 5; i++) {
                assertTrue(check(limiter).allowed(), "request " + (i + 1));
            }

            assertFalse(check(limiter).allowed());
        }

        @Test
        @DisplayName("should report remaining as whole tokens left")
        void shouldReportRemaining() {
            final var limiter = new TokenBucketRateLimiter(store, RateLimitPolicy.of(3, 3), clock);

            assertEquals(2, check(limiter).remaining());
            assertEquals(1, check(limiter).remaining());
            assertEquals(0, check(limiter).remaining());
        }
    }

    @Nested
    @DisplayName("Refill")
    class RefillTests {

        @Test
        @DisplayName("should admit exactly one more request after one refill interval")
        void shouldAdmitOneAfterRefillInterval() {
            final var limiter = new TokenBucketRateLimiter(store, RateLimitPolicy.of(5, 5), clock);
            for (var i = 0; i < 5; i++) {
                check(limiter);
            }
            assertFalse(check(limiter).allowed());

            clock.advance(Duration.ofSeconds(1));

            assertTrue(check(limiter).allowed());
            assertFalse(check(limiter).allowed());
        }

        @Test
        @DisplayName("should never refill beyond capacity")
        void shouldNotExceedCapacity() {
            final var limiter = new TokenBucketRateLimiter(store, RateLimitPolicy.of(3, 3), clock);
            check(limiter);

            clock.advance(Duration.ofHours(1));

            assertEquals(2, check(limiter).remaining());
        }

        @Test
        @DisplayName("should reset now while tokens remain and later once empty")
        void shouldComputeResetAt() {
            final var limiter = new TokenBucketRateLimiter(store, RateLimitPolicy.of(2, 4), clock);

            assertEquals(START, check(limiter).resetAt());

            final var empty = check(limiter);
            assertEquals(0, empty.remaining());
            // 0.5 tokens per second, one token takes 2s
            assertEquals(START.plusSeconds(2), empty.resetAt());
        }
    }
}
