package linkguard.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import linkguard.support.MutableClock;

@DisplayName("InMemoryRateLimitStore")
class InMemoryRateLimitStoreTest {

    private static final Duration TTL = Duration.ofSeconds(10);

    private MutableClock clock;
    private InMemoryRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        store = new InMemoryRateLimitStore(clock, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("incrementAndExpire")
    class IncrementTests {

        @Test
        @DisplayName("should count per key")
        void shouldCountPerKey() {
            assertEquals(1L, store.incrementAndExpire("a", TTL).await().indefinitely());
            assertEquals(2L, store.incrementAndExpire("a", TTL).await().indefinitely());
            assertEquals(1L, store.incrementAndExpire("b", TTL).await().indefinitely());
        }

        @Test
        @DisplayName("should restart the count once the entry expires")
        void shouldRestartAfterExpiry() {
            store.incrementAndExpire("a", TTL).await().indefinitely();
            store.incrementAndExpire("a", TTL).await().indefinitely();

            clock.advance(TTL);

            assertEquals(1L, store.incrementAndExpire("a", TTL).await().indefinitely());
        }

        @Test
        @DisplayName("should not lose increments under contention")
        void shouldNotLoseIncrements() throws InterruptedException {
            final var executor = Executors.newFixedThreadPool(8);
            final var start = new CountDownLatch(1);
            final var failures = new AtomicInteger();

            for (var t = 0; t < 8; t++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        for (var i = 0; i < 500; i++) {
                            store.incrementAndExpire("hot", TTL).await().indefinitely();
                        }
                    } catch (InterruptedException e) {
                        failures.incrementAndGet();
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

            assertEquals(0, failures.get());
            assertEquals(4_001L, store.incrementAndExpire("hot", TTL).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("recordAndCount")
    class RecordTests {

        @Test
        @DisplayName("should drop events older than the window start")
        void shouldTrimOldEvents() {
            assertEquals(1L, store.recordAndCount("k", 0, 100, TTL).await().indefinitely());
            assertEquals(2L, store.recordAndCount("k", 0, 200, TTL).await().indefinitely());
            assertEquals(2L, store.recordAndCount("k", 150, 300, TTL).await().indefinitely());
            assertEquals(1L, store.recordAndCount("k", 301, 400, TTL).await().indefinitely());
        }

        @Test
        @DisplayName("should keep an event exactly at the window start")
        void shouldKeepEventAtWindowStart() {
            store.recordAndCount("k", 0, 100, TTL).await().indefinitely();

            assertEquals(2L, store.recordAndCount("k", 100, 200, TTL).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("takeToken")
    class TakeTokenTests {

        @Test
        @DisplayName("should start full and drain")
        void shouldStartFullAndDrain() {
            final var now = clock.instant().getEpochSecond();

            final var first = store.takeToken("b", 2, 1.0, now, TTL).await().indefinitely();
            final var second = store.takeToken("b", 2, 1.0, now, TTL).await().indefinitely();
            final var third = store.takeToken("b", 2, 1.0, now, TTL).await().indefinitely();

            assertTrue(first.consumed());
            assertEquals(1.0, first.tokens(), 1e-9);
            assertTrue(second.consumed());
            assertFalse(third.consumed());
            assertEquals(0.0, third.tokens(), 1e-9);
        }

        @Test
        @DisplayName("should refill with elapsed time")
        void shouldRefill() {
            final var now = clock.instant().getEpochSecond();
            store.takeToken("b", 2, 0.5, now, TTL).await().indefinitely();
            store.takeToken("b", 2, 0.5, now, TTL).await().indefinitely();

            final var later = store.takeToken("b", 2, 0.5, now + 4, TTL).await().indefinitely();

            assertTrue(later.consumed());
            assertEquals(1.0, later.tokens(), 1e-9);
            assertEquals(now + 4, later.lastRefillEpochSeconds());
        }
    }

    @Test
    @DisplayName("should purge expired entries")
    void shouldPurgeExpired() {
        store.incrementAndExpire("a", TTL).await().indefinitely();
        store.recordAndCount("b", 0, 1, TTL).await().indefinitely();
        store.takeToken("c", 1, 1.0, 0, Duration.ofSeconds(30)).await().indefinitely();
        assertEquals(3, store.keyCount());

        clock.advance(Duration.ofSeconds(11));
        store.purgeExpired();

        assertEquals(1, store.keyCount());
    }
}
