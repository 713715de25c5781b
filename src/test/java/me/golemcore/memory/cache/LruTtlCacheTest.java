package me.golemcore.memory.cache;

import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LruTtlCacheTest {

    private static final Duration TTL = Duration.ofSeconds(10);

    private MutableClock clock;
    private LruTtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new LruTtlCache<>(2, clock);
    }

    @Test
    void shouldReturnStoredValueBeforeExpiry() {
        cache.put("a", "1", TTL);
        clock.advance(Duration.ofSeconds(9));

        assertEquals(Optional.of("1"), cache.get("a"));
    }

    @Test
    void shouldDropExpiredEntryOnAccess() {
        cache.put("a", "1", TTL);
        clock.advance(TTL);

        assertTrue(cache.get("a").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        cache.put("a", "1", TTL);
        cache.put("b", "2", TTL);
        cache.get("a");
        cache.put("c", "3", TTL);

        assertTrue(cache.get("b").isEmpty());
        assertEquals(Optional.of("1"), cache.get("a"));
        assertEquals(Optional.of("3"), cache.get("c"));
        assertEquals(1, cache.stats().evictions());
    }

    @Test
    void shouldRemoveMatchingKeys() {
        cache.put("search:x", "1", TTL);
        cache.put("list:y", "2", TTL);

        assertEquals(1, cache.removeIf(key -> key.startsWith("search:")));
        assertEquals(1, cache.size());
    }

    @Test
    void shouldCountHitsAndMisses() {
        cache.put("a", "1", TTL);
        cache.get("a");
        cache.get("missing");

        LruTtlCache.Stats stats = cache.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
    }

    @Test
    void shouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(0, clock));
    }
}
