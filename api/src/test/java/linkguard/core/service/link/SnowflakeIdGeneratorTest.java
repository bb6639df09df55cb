package linkguard.core.service.link;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import linkguard.support.MutableClock;

@DisplayName("SnowflakeIdGenerator")
class SnowflakeIdGeneratorTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("should reject node parts outside 0..31")
    void shouldRejectInvalidNodeParts() {
        assertThrows(IllegalArgumentException.class, () -> new SnowflakeIdGenerator(32, 0, clock));
        assertThrows(IllegalArgumentException.class, () -> new SnowflakeIdGenerator(0, -1, clock));
    }

    @Test
    @DisplayName("should pack timestamp, node and sequence")
    void shouldPackLayout() {
        final var generator = new SnowflakeIdGenerator(3, 7, clock);

        final var first = generator.nextId();
        final var second = generator.nextId();

        assertEquals(clock.millis() - SnowflakeIdGenerator.EPOCH_MILLIS, first >>> 22);
        assertEquals((3 << 5) | 7, (first >>> 12) & 0x3FF);
        assertEquals(0, first & 0xFFF);
        assertEquals(1, second & 0xFFF);
        assertEquals(103, generator.nodeId());
    }

    @Test
    @DisplayName("should stay strictly increasing when the clock stands still or moves back")
    void shouldStayMonotonic() {
        final var generator = new SnowflakeIdGenerator(0, 0, clock);
        var previous = generator.nextId();

        for (var i = 0; i < 10_000; i++) {
            if (i == 5_000) {
                clock.advance(Duration.ofMillis(-50));
            }
            final var next = generator.nextId();
            assertTrue(next > previous);
            previous = next;
        }
    }

    @Test
    @DisplayName("should give different nodes different codes at the same instant")
    void shouldSeparateNodes() {
        final var a = new SnowflakeIdGenerator(0, 1, clock);
        final var b = new SnowflakeIdGenerator(0, 2, clock);

        assertNotEquals(a.nextCode(), b.nextCode());
    }

    @Test
    @DisplayName("should not issue duplicates across threads")
    void shouldBeUniqueAcrossThreads() throws InterruptedException {
        final var generator = new SnowflakeIdGenerator(1, 1, Clock.systemUTC());
        final Set<String> codes = ConcurrentHashMap.newKeySet();
        final var executor = Executors.newFixedThreadPool(4);

        for (var t = 0; t < 4; t++) {
            executor.submit(() -> {
                final var local = new HashSet<String>();
                for (var i = 0; i < 5_000; i++) {
                    local.add(generator.nextCode());
                }
                codes.addAll(local);
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(20_000, codes.size());
    }
}
