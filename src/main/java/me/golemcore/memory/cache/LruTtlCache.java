package me.golemcore.memory.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Bounded in-process map with least-recently-used eviction and per-entry
 * expiry. Expired entries are dropped lazily on access.
 *
 * @param <K>
 *            key type
 * @param <V>
 *            value type
 */
public class LruTtlCache<K, V> {

    private final int maxSize;
    private final Clock clock;
    private final LinkedHashMap<K, CachedValue<V>> entries;

    private long hits;
    private long misses;
    private long evictions;

    public LruTtlCache(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, CachedValue<V>> eldest) {
                boolean evict = size() > LruTtlCache.this.maxSize;
                if (evict) {
                    evictions++;
                }
                return evict;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        CachedValue<V> cached = entries.get(key);
        if (cached == null) {
            misses++;
            return Optional.empty();
        }
        if (cached.isExpired(clock.instant())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(cached.value());
    }

    public synchronized void put(K key, V value, Duration ttl) {
        entries.put(key, new CachedValue<>(value, clock.instant().plus(ttl)));
    }

    public synchronized void remove(K key) {
        entries.remove(key);
    }

    /**
     * Remove every entry whose key matches.
     *
     * @return number of removed entries
     */
    public synchronized int removeIf(Predicate<K> keyFilter) {
        int before = entries.size();
        entries.keySet().removeIf(keyFilter);
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Stats stats() {
        return new Stats(entries.size(), maxSize, hits, misses, evictions);
    }

    public record Stats(int size, int maxSize, long hits, long misses, long evictions) {
    }

    private record CachedValue<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
