package me.golemcore.memory.knowledge;

import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageCountBufferTest {

    private MutableClock clock;
    private UsageCountBuffer buffer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        buffer = new UsageCountBuffer(3, Duration.ofSeconds(30), clock);
    }

    @Test
    void shouldNotFlushEmptyBuffer() {
        clock.advance(Duration.ofMinutes(5));

        assertFalse(buffer.shouldFlush());
    }

    @Test
    void shouldFlushWhenThresholdReached() {
        buffer.increment(List.of("a", "b"));
        assertFalse(buffer.shouldFlush());

        buffer.increment(List.of("a"));

        assertTrue(buffer.shouldFlush());
        assertEquals(2, buffer.pendingFor("a"));
        assertEquals(3, buffer.pendingTotal());
    }

    @Test
    void shouldFlushWhenIntervalElapsed() {
        buffer.increment(List.of("a"));
        clock.advance(Duration.ofSeconds(29));
        assertFalse(buffer.shouldFlush());

        clock.advance(Duration.ofSeconds(1));

        assertTrue(buffer.shouldFlush());
    }

    @Test
    void shouldResetOnDrain() {
        buffer.increment(List.of("a", "a", "b"));

        Map<String, Integer> drained = buffer.drain();

        assertEquals(Map.of("a", 2, "b", 1), drained);
        assertEquals(0, buffer.pendingTotal());
        assertEquals(0, buffer.pendingFor("a"));
    }

    @Test
    void shouldMergeRestoredIncrements() {
        buffer.increment(List.of("a"));
        Map<String, Integer> drained = buffer.drain();
        buffer.increment(List.of("a", "c"));

        buffer.restore(drained);

        assertEquals(2, buffer.pendingFor("a"));
        assertEquals(1, buffer.pendingFor("c"));
        assertEquals(3, buffer.pendingTotal());
    }

    @Test
    void shouldDiscardDeletedIds() {
        buffer.increment(List.of("a", "a", "b"));

        buffer.discard(List.of("a", "missing"));

        assertEquals(0, buffer.pendingFor("a"));
        assertEquals(1, buffer.pendingTotal());
    }
}
