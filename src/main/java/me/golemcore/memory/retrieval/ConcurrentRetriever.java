package me.golemcore.memory.retrieval;

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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.cache.LruTtlCache;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.text.ContentHash;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans one query out to every registered memory source of an owner.
 *
 * <p>
 * All sources run concurrently on the shared retrieval pool and are awaited
 * against one deadline, so the call takes about as long as the slowest source
 * and never much longer than the per-source timeout. A source that times out
 * or fails contributes an empty list and counts against its circuit breaker;
 * a source whose breaker is open is not called at all.
 *
 * <p>
 * Merged results of rounds where every source answered are cached under a
 * key built from the owner, the write version of each source, the query and
 * the k values, so a write to one source only retires the entries that read
 * it.
 */
@Slf4j
public class ConcurrentRetriever {

    private static final double LATENCY_SMOOTHING = 0.3;

    private final String ownerId;
    private final Map<String, MemorySource> sources = new LinkedHashMap<>();
    private final SourceBreakers breakers;
    private final ExecutorService executor;
    private final MemoryProperties.RetrievalProperties config;
    private final LruTtlCache<String, Map<String, List<String>>> cache;

    private final AtomicLong totalRetrievals = new AtomicLong();
    private final AtomicLong totalTimeNanos = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong lastLatencyMillis = new AtomicLong();
    private final Map<String, Double> sourceLatencyMillis = new TreeMap<>();

    public ConcurrentRetriever(String ownerId, List<MemorySource> sources, SourceBreakers breakers,
            ExecutorService executor, MemoryProperties.RetrievalProperties config, Clock clock) {
        this.ownerId = ownerId;
        sources.forEach(source -> this.sources.put(source.name(), source));
        this.breakers = breakers;
        this.executor = executor;
        this.config = config;
        this.cache = new LruTtlCache<>(config.getCacheMaxSize(), clock);
    }

    public Map<String, List<String>> retrieve(String query) {
        return retrieve(query, Map.of(), true);
    }

    /**
     * Query the sources concurrently.
     *
     * @param perSourceK
     *            results per source; sources not listed use the default k, and
     *            a k of zero skips the source
     * @return results keyed by source name, every registered source present
     */
    public Map<String, List<String>> retrieve(String query, Map<String, Integer> perSourceK, boolean useCache) {
        if (query == null || query.isBlank()) {
            return emptyResult();
        }
        long start = System.nanoTime();
        Map<String, Integer> ks = effectiveK(perSourceK);
        String key = cacheKey(query, ks);

        if (useCache) {
            Optional<Map<String, List<String>>> cached = cache.get(key);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                record(start);
                return copy(cached.get());
            }
        }

        Map<String, List<String>> results = new LinkedHashMap<>();
        Map<String, Pending> pending = new LinkedHashMap<>();
        boolean complete = true;
        for (MemorySource source : sources.values()) {
            int k = ks.get(source.name());
            results.put(source.name(), List.of());
            if (k <= 0) {
                continue;
            }
            CircuitBreaker breaker = breakers.forSource(source.name());
            if (!breaker.tryAcquirePermission()) {
                log.debug("[ConcurrentRetriever] Breaker open for '{}', skipping", source.name());
                complete = false;
                continue;
            }
            try {
                Future<List<String>> task = executor.submit(() -> source.search(query, k));
                pending.put(source.name(), new Pending(task, breaker, System.nanoTime()));
            } catch (RejectedExecutionException e) {
                breaker.releasePermission();
                complete = false;
                log.warn("[ConcurrentRetriever] Retrieval pool rejected '{}'", source.name());
            }
        }

        long deadline = start + TimeUnit.MILLISECONDS.toNanos(config.getPerSourceTimeoutMillis());
        for (Map.Entry<String, Pending> entry : pending.entrySet()) {
            String name = entry.getKey();
            Pending task = entry.getValue();
            try {
                List<String> found = task.future().get(Math.max(0, deadline - System.nanoTime()),
                        TimeUnit.NANOSECONDS);
                long elapsed = System.nanoTime() - task.startNanos();
                task.breaker().onSuccess(elapsed, TimeUnit.NANOSECONDS);
                results.put(name, found != null ? List.copyOf(found) : List.of());
                recordSourceLatency(name, elapsed);
            } catch (TimeoutException e) {
                complete = false;
                task.future().cancel(true);
                task.breaker().onError(System.nanoTime() - task.startNanos(), TimeUnit.NANOSECONDS, e);
                log.warn("[ConcurrentRetriever] '{}' timed out after {} ms", name,
                        config.getPerSourceTimeoutMillis());
            } catch (ExecutionException | CancellationException e) {
                complete = false;
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                task.breaker().onError(System.nanoTime() - task.startNanos(), TimeUnit.NANOSECONDS, cause);
                log.warn("[ConcurrentRetriever] '{}' failed: {}", name, cause.getMessage());
            } catch (InterruptedException e) {
                complete = false;
                Thread.currentThread().interrupt();
                pending.values().forEach(remaining -> {
                    if (remaining.future().cancel(true)) {
                        remaining.breaker().releasePermission();
                    }
                });
                log.warn("[ConcurrentRetriever] Interrupted while waiting for sources");
                break;
            }
        }

        if (useCache && complete) {
            cache.put(key, copy(results), Duration.ofSeconds(config.getCacheTtlSeconds()));
        }
        record(start);
        log.debug("[ConcurrentRetriever] owner={} sources={} took {} ms", ownerId, results.keySet(),
                lastLatencyMillis.get());
        return results;
    }

    public void clearCache() {
        cache.clear();
    }

    public List<String> sourceNames() {
        return new ArrayList<>(sources.keySet());
    }

    public Stats stats() {
        long total = totalRetrievals.get();
        Map<String, Double> latencies;
        synchronized (sourceLatencyMillis) {
            latencies = new TreeMap<>(sourceLatencyMillis);
        }
        Map<String, String> breakerStates = new TreeMap<>();
        breakers.states().forEach((name, state) -> breakerStates.put(name, state.name()));
        return new Stats(total, total > 0 ? totalTimeNanos.get() / 1_000_000.0 / total : 0.0, cacheHits.get(),
                lastLatencyMillis.get(), latencies, breakerStates);
    }

    private Map<String, Integer> effectiveK(Map<String, Integer> perSourceK) {
        Map<String, Integer> ks = new TreeMap<>();
        for (String name : sources.keySet()) {
            Integer k = perSourceK != null ? perSourceK.get(name) : null;
            ks.put(name, k != null ? k : config.getDefaultK());
        }
        return ks;
    }

    private String cacheKey(String query, Map<String, Integer> ks) {
        StringBuilder key = new StringBuilder(ownerId).append('|').append(query);
        for (Map.Entry<String, Integer> entry : ks.entrySet()) {
            key.append('|').append(entry.getKey()).append(':').append(entry.getValue())
                    .append('@').append(sources.get(entry.getKey()).writeVersion());
        }
        return ContentHash.md5(key.toString());
    }

    private void recordSourceLatency(String name, long elapsedNanos) {
        double millis = elapsedNanos / 1_000_000.0;
        synchronized (sourceLatencyMillis) {
            sourceLatencyMillis.merge(name, millis,
                    (previous, latest) -> LATENCY_SMOOTHING * latest + (1 - LATENCY_SMOOTHING) * previous);
        }
    }

    private void record(long startNanos) {
        long elapsed = System.nanoTime() - startNanos;
        totalRetrievals.incrementAndGet();
        totalTimeNanos.addAndGet(elapsed);
        lastLatencyMillis.set(TimeUnit.NANOSECONDS.toMillis(elapsed));
    }

    private Map<String, List<String>> emptyResult() {
        Map<String, List<String>> empty = new LinkedHashMap<>();
        sources.keySet().forEach(name -> empty.put(name, List.of()));
        return empty;
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> results) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        results.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return copy;
    }

    public record Stats(long totalRetrievals, double averageTimeMillis, long cacheHits, long lastLatencyMillis,
            Map<String, Double> sourceLatencyMillis, Map<String, String> breakerStates) {
    }

    private record Pending(Future<List<String>> future, CircuitBreaker breaker, long startNanos) {
    }
}
