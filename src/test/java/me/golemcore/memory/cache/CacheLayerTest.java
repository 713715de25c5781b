package me.golemcore.memory.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.port.outbound.RemoteCachePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheLayerTest {

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final Duration TTL = Duration.ofMinutes(1);

    private RemoteCachePort remote;
    private CacheLayer cache;

    @BeforeEach
    void setUp() {
        remote = mock(RemoteCachePort.class);
        when(remote.isAvailable()).thenReturn(true);
        when(remote.set(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));
        when(remote.delete(anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(remote.deleteByPrefix(anyString())).thenReturn(CompletableFuture.completedFuture(null));
        cache = new CacheLayer("owner1", new LruTtlCache<>(16, Clock.systemUTC()), remote, new ObjectMapper());
    }

    @Test
    void shouldServeLocalHitWithoutRemoteCall() {
        cache.put(CacheLayer.SEARCH, "q", List.of("a"), TTL);

        assertEquals(Optional.of(List.of("a")), cache.get(CacheLayer.SEARCH, "q", STRINGS, TTL));
        verify(remote, never()).get(anyString());
        verify(remote).set(eq("owner1:search:q"), eq("[\"a\"]"), eq(TTL));
    }

    @Test
    void shouldPromoteRemoteHitIntoLocalTier() {
        when(remote.get("owner1:search:q"))
                .thenReturn(CompletableFuture.completedFuture(Optional.of("[\"b\"]")));

        assertEquals(Optional.of(List.of("b")), cache.get(CacheLayer.SEARCH, "q", STRINGS, TTL));
        assertEquals(1, cache.stats().l2Hits());
        assertEquals(1, cache.stats().l1Size());
    }

    @Test
    void shouldTreatRemoteFailureAsMiss() {
        when(remote.get(anyString())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertTrue(cache.get(CacheLayer.SEARCH, "q", STRINGS, TTL).isEmpty());
        assertEquals(1, cache.stats().l2Errors());
    }

    @Test
    void shouldInvalidateWholeNamespaceOnly() {
        when(remote.get(anyString())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        cache.put(CacheLayer.SEARCH, "q1", List.of("a"), TTL);
        cache.put(CacheLayer.SEARCH, "q2", List.of("b"), TTL);
        cache.put(CacheLayer.ALL_ENTRIES, "list", List.of("c"), TTL);

        cache.invalidateNamespace(CacheLayer.SEARCH);

        assertTrue(cache.get(CacheLayer.SEARCH, "q1", STRINGS, TTL).isEmpty());
        assertTrue(cache.get(CacheLayer.SEARCH, "q2", STRINGS, TTL).isEmpty());
        assertFalse(cache.get(CacheLayer.ALL_ENTRIES, "list", STRINGS, TTL).isEmpty());
        verify(remote).deleteByPrefix("owner1:search:");
    }

    @Test
    void shouldWorkWithoutRemoteTier() {
        CacheLayer local = new CacheLayer("owner1", new LruTtlCache<>(4, Clock.systemUTC()), null,
                new ObjectMapper());
        local.put(CacheLayer.STATISTICS, "summary", List.of("s"), TTL);

        assertEquals(Optional.of(List.of("s")), local.get(CacheLayer.STATISTICS, "summary", STRINGS, TTL));
        assertFalse(local.stats().remoteEnabled());
    }
}
