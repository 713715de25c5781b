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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.port.outbound.RemoteCachePort;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache scoped to one owner.
 *
 * <p>
 * L1 is a bounded {@link LruTtlCache}; L2 is the optional
 * {@link RemoteCachePort}. {@code get} checks L1, then L2, promoting L2 hits
 * into L1; {@code put} writes both tiers. Keys are namespaced per logical
 * dataset ({@link #ALL_ENTRIES}, {@link #STATISTICS}, {@link #SEARCH}) so a
 * change can invalidate only the namespaces it affects.
 *
 * <p>
 * Nothing here is authoritative: losing an entry only costs a recomputation,
 * and L2 failures degrade to L1-only operation.
 */
@Slf4j
public class CacheLayer {

    public static final String ALL_ENTRIES = "all_entries";
    public static final String STATISTICS = "statistics";
    public static final String SEARCH = "search";

    private static final String SEPARATOR = ":";

    private final String scope;
    private final LruTtlCache<String, Object> l1;
    private final RemoteCachePort remote;
    private final ObjectMapper objectMapper;

    private final AtomicLong l2Hits = new AtomicLong();
    private final AtomicLong l2Errors = new AtomicLong();

    /**
     * @param remote
     *            second tier, may be {@code null}
     */
    public CacheLayer(String scope, LruTtlCache<String, Object> l1, RemoteCachePort remote,
            ObjectMapper objectMapper) {
        this.scope = scope;
        this.l1 = l1;
        this.remote = remote;
        this.objectMapper = objectMapper;
    }

    public <T> Optional<T> get(String namespace, String key, TypeReference<T> type, Duration promoteTtl) {
        String localKey = localKey(namespace, key);
        Optional<Object> local = l1.get(localKey);
        if (local.isPresent()) {
            @SuppressWarnings("unchecked")
            T value = (T) local.get();
            return Optional.of(value);
        }

        if (!isRemoteAvailable()) {
            return Optional.empty();
        }
        try {
            Optional<String> json = remote.get(remoteKey(localKey)).join();
            if (json.isEmpty()) {
                return Optional.empty();
            }
            T value = objectMapper.readValue(json.get(), type);
            l1.put(localKey, value, promoteTtl);
            l2Hits.incrementAndGet();
            return Optional.ofNullable(value);
        } catch (CompletionException | JsonProcessingException e) {
            l2Errors.incrementAndGet();
            log.debug("[Cache] L2 read failed for {}: {}", localKey, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String namespace, String key, Object value, Duration ttl) {
        String localKey = localKey(namespace, key);
        l1.put(localKey, value, ttl);
        if (!isRemoteAvailable()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            remote.set(remoteKey(localKey), json, ttl)
                    .exceptionally(error -> {
                        l2Errors.incrementAndGet();
                        log.debug("[Cache] L2 write failed for {}: {}", localKey, error.getMessage());
                        return null;
                    });
        } catch (JsonProcessingException e) {
            log.debug("[Cache] Value for {} is not serializable, kept in L1 only", localKey);
        }
    }

    public void invalidate(String namespace, String key) {
        String localKey = localKey(namespace, key);
        l1.remove(localKey);
        if (isRemoteAvailable()) {
            remote.delete(remoteKey(localKey)).exceptionally(error -> null);
        }
    }

    /**
     * Drop every key of one namespace in both tiers.
     */
    public void invalidateNamespace(String namespace) {
        String prefix = namespace + SEPARATOR;
        int removed = l1.removeIf(key -> key.startsWith(prefix));
        if (isRemoteAvailable()) {
            remote.deleteByPrefix(remoteKey(prefix)).exceptionally(error -> null);
        }
        if (removed > 0) {
            log.trace("[Cache] Invalidated {} keys in {}:{}", removed, scope, namespace);
        }
    }

    public void clear() {
        l1.clear();
        if (isRemoteAvailable()) {
            remote.deleteByPrefix(scope + SEPARATOR).exceptionally(error -> null);
        }
    }

    public Stats stats() {
        LruTtlCache.Stats local = l1.stats();
        return new Stats(local.size(), local.hits(), local.misses(), l2Hits.get(), l2Errors.get(),
                isRemoteAvailable());
    }

    private boolean isRemoteAvailable() {
        return remote != null && remote.isAvailable();
    }

    private static String localKey(String namespace, String key) {
        return namespace + SEPARATOR + key;
    }

    private String remoteKey(String localKey) {
        return scope + SEPARATOR + localKey;
    }

    public record Stats(int l1Size, long l1Hits, long l1Misses, long l2Hits, long l2Errors,
            boolean remoteEnabled) {
    }
}
