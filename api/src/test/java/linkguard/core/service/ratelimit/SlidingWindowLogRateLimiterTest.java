package linkguard.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import linkguard.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.support.MutableClock;

@DisplayName("SlidingWindowLogRateLimiter")
class SlidingWindowLogRateLimiterTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryRateLimitStore store;
    private SlidingWindowLogRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryRateLimitStore(clock, Duration.ofHours(1));
        limiter = new SlidingWindowLogRateLimiter(store, RateLimitPolicy.of(3, 2), clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private RateLimitDecision check() {
        return limiter.check("client").await().indefinitely();
    }

    @Test
    @DisplayName("should admit the limit and deny the next request")
    void shouldAdmitLimitThenDeny() {
        assertEquals(2, check().remaining());
        assertEquals(1, check().remaining());
        assertEquals(0, check().remaining());

        final var denied = check();

        assertFalse(denied.allowed());
        assertEquals(0, denied.remaining());
    }

    @Test
    @DisplayName("should admit again once the window has passed")
    void shouldAdmitAfterWindow() {
        check();
        check();
        check();
        assertFalse(check().allowed());

        clock.advance(Duration.ofMillis(2500));

        assertTrue(check().allowed());
    }

    @Test
    @DisplayName("should still deny just before the oldest entries age out")
    void shouldDenyJustBeforeWindowEnd() {
        check();
        check();
        check();

        clock.set(START.plus(Duration.ofSeconds(2)).minusMillis(1));

        assertFalse(check().allowed());
    }

    @Test
    @DisplayName("should admit just after the oldest entries age out")
    void shouldAdmitJustAfterWindowEnd() {
        check();
        check();
        check();

        clock.set(START.plus(Duration.ofSeconds(2)).plusMillis(1));

        assertTrue(check().allowed());
    }

    @Test
    @DisplayName("should count calls within the same clock tick separately")
    void shouldCountSameTickCallsSeparately() {
        for (var i = 0; i < 3; i++) {
            assertTrue(check().allowed());
        }

        assertFalse(check().allowed());
    }

    @Test
    @DisplayName("should approximate reset as now plus window")
    void shouldApproximateResetAsNowPlusWindow() {
        final var decision = check();

        assertEquals(START.plusSeconds(2), decision.resetAt());
    }
}
