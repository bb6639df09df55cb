package linkguard.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitPolicy")
class RateLimitPolicyTest {

    @Test
    @DisplayName("should reject a non-positive limit")
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> RateLimitPolicy.of(0, 60));
        assertThrows(IllegalArgumentException.class, () -> RateLimitPolicy.of(-1, 60));
    }

    @Test
    @DisplayName("should reject a non-positive window")
    void shouldRejectNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(10, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(10, Duration.ofSeconds(-1)));
    }

    @Test
    @DisplayName("should derive refill rate and state TTL")
    void shouldDeriveRateAndTtl() {
        final var policy = RateLimitPolicy.of(100, 60);

        assertEquals(100.0 / 60.0, policy.refillRatePerSecond(), 1e-9);
        assertEquals(Duration.ofSeconds(120), policy.stateTtl());
    }
}
