package linkguard.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import linkguard.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import linkguard.core.model.ratelimit.AdmissionOutcome;
import linkguard.core.model.ratelimit.AdmissionRequest;
import linkguard.core.model.ratelimit.IdentityKeyType;
import linkguard.core.model.ratelimit.RateLimitAlgorithm;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.core.model.ratelimit.SkipPredicate;
import linkguard.core.port.out.Metrics;
import linkguard.core.port.out.RateLimiter;
import linkguard.support.MutableClock;

@DisplayName("AdmissionService")
@ExtendWith(MockitoExtension.class)
class AdmissionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.500Z");
    private static final String PREFIX = "linkguard:ratelimit:";

    @Mock
    private Metrics metrics;

    @Mock
    private RateLimiter limiter;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        lenient().when(limiter.algorithm()).thenReturn(RateLimitAlgorithm.FIXED_WINDOW);
    }

    private AdmissionService service(RateLimiter rateLimiter, SkipPredicate skip) {
        return new AdmissionService(
                "global", rateLimiter, IdentityKeyType.CALLER_AND_TARGET.strategy(PREFIX), skip, metrics, clock);
    }

    private AdmissionOutcome admit(AdmissionService service, String path) {
        return service.admit(new AdmissionRequest("10.0.0.1", "GET", path)).await().indefinitely();
    }

    @Nested
    @DisplayName("Decisions")
    class DecisionTests {

        @Test
        @DisplayName("should attach quota headers to allowed requests")
        void shouldAttachHeadersWhenAllowed() {
            when(limiter.check("linkguard:ratelimit:10.0.0.1:/abc"))
                    .thenReturn(Uni.createFrom().item(RateLimitDecision.allow(7, 10, NOW.plusSeconds(30))));

            final var outcome = admit(service(limiter, SkipPredicate.never()), "/abc");

            assertEquals(AdmissionOutcome.Status.ALLOWED, outcome.status());
            final var headers = outcome.headers().orElseThrow().asMap();
            assertEquals("10", headers.get("X-RateLimit-Limit"));
            assertEquals("7", headers.get("X-RateLimit-Remaining"));
            assertEquals(String.valueOf(NOW.plusSeconds(30).getEpochSecond()), headers.get("X-RateLimit-Reset"));
            assertFalse(headers.containsKey("Retry-After"));
            verify(metrics).recordRateLimitDecision(RateLimitAlgorithm.FIXED_WINDOW, true);
        }

        @Test
        @DisplayName("should add retry-after to denied requests")
        void shouldAddRetryAfterWhenDenied() {
            when(limiter.check(anyString()))
                    .thenReturn(Uni.createFrom()
                            .item(RateLimitDecision.rejected(0, 10, Instant.parse("2024-05-01T12:00:42Z"))));

            final var outcome = admit(service(limiter, SkipPredicate.never()), "/abc");

            assertEquals(AdmissionOutcome.Status.DENIED, outcome.status());
            assertFalse(outcome.admitted());
            final var headers = outcome.headers().orElseThrow();
            assertEquals(42, headers.retryAfterSeconds().getAsLong());
            assertEquals("0", headers.asMap().get("X-RateLimit-Remaining"));
        }

        @Test
        @DisplayName("should floor retry-after at zero when reset is in the past")
        void shouldFloorRetryAfter() {
            when(limiter.check(anyString()))
                    .thenReturn(Uni.createFrom().item(RateLimitDecision.rejected(0, 10, NOW.minusSeconds(5))));

            final var outcome = admit(service(limiter, SkipPredicate.never()), "/abc");

            assertEquals(0, outcome.headers().orElseThrow().retryAfterSeconds().getAsLong());
        }
    }

    @Nested
    @DisplayName("Fail open")
    class FailOpenTests {

        @Test
        @DisplayName("should admit without headers when the limiter fails")
        void shouldAdmitWhenLimiterFails() {
            when(limiter.check(anyString()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("connection refused")));

            final var outcome = admit(service(limiter, SkipPredicate.never()), "/abc");

            assertEquals(AdmissionOutcome.Status.FAILED_OPEN, outcome.status());
            assertTrue(outcome.admitted());
            assertTrue(outcome.headers().isEmpty());
            assertEquals("linkguard:ratelimit:10.0.0.1:/abc", outcome.identity().orElseThrow());
            verify(metrics).recordRateLimitFailOpen(RateLimitAlgorithm.FIXED_WINDOW);
        }

        @Test
        @DisplayName("should admit when the limiter throws synchronously")
        void shouldAdmitWhenLimiterThrows() {
            when(limiter.check(anyString())).thenThrow(new IllegalStateException("boom"));

            final var outcome = admit(service(limiter, SkipPredicate.never()), "/abc");

            assertEquals(AdmissionOutcome.Status.FAILED_OPEN, outcome.status());
        }
    }

    @Nested
    @DisplayName("Skip predicate")
    class SkipTests {

        private InMemoryRateLimitStore store;

        @AfterEach
        void tearDown() {
            if (store != null) {
                store.shutdown();
            }
        }

        @Test
        @DisplayName("should never touch limiter state for skipped requests")
        void shouldNotTouchStateWhenSkipped() {
            store = new InMemoryRateLimitStore(clock, Duration.ofHours(1));
            final var realLimiter = new FixedWindowRateLimiter(store, RateLimitPolicy.of(1, 60), clock);
            final var service = service(realLimiter, SkipPredicate.pathPrefixes(List.of("/health", "/q/")));

            for (var i = 0; i < 5; i++) {
                assertEquals(AdmissionOutcome.Status.SKIPPED, admit(service, "/health").status());
                assertEquals(AdmissionOutcome.Status.SKIPPED, admit(service, "/q/metrics").status());
            }

            assertEquals(0, store.keyCount());
            assertEquals(AdmissionOutcome.Status.ALLOWED, admit(service, "/abc").status());
            assertEquals(1, store.keyCount());
        }

        @Test
        @DisplayName("should not consult the limiter for skipped requests")
        void shouldNotConsultLimiter() {
            final var outcome = admit(service(limiter, request -> true), "/anything");

            assertEquals(AdmissionOutcome.Status.SKIPPED, outcome.status());
            assertTrue(outcome.identity().isEmpty());
            verify(limiter, never()).check(anyString());
        }
    }
}
