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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.RetrievalCandidate;
import me.golemcore.memory.infrastructure.config.MemoryProperties;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Hybrid (vector + BM25) retrieval over one corpus.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Fetch the top {@code 3k} vector neighbours, ignoring those with zero
 * similarity</li>
 * <li>Score the corpus with BM25, keeping the top {@code 10k} documents</li>
 * <li>Min-max normalize BM25 scores; an all-equal score vector normalizes to
 * zero</li>
 * <li>{@code fused = alpha * vector + (1 - alpha) * bm25}; alpha is forced to
 * 1.0 when BM25 yields no discriminative signal</li>
 * <li>Merge lexical-only hits, drop results below {@code threshold}, apply the
 * category filter</li>
 * <li>Stable sort by fused score descending, then by vector rank</li>
 * </ol>
 *
 * <p>
 * The BM25 index is built lazily from a corpus snapshot, once, under a lock.
 * {@link #invalidate()} marks it stale after the corpus changes; the next
 * search rebuilds it.
 */
@Slf4j
public class HybridRetriever {

    private final EmbeddingStore embeddingStore;
    private final Supplier<List<RetrievalCandidate>> corpus;
    private final MemoryProperties.HybridProperties config;
    private final ReentrantLock indexLock = new ReentrantLock();

    private volatile IndexSnapshot snapshot;

    public HybridRetriever(EmbeddingStore embeddingStore, Supplier<List<RetrievalCandidate>> corpus,
            MemoryProperties.HybridProperties config) {
        this.embeddingStore = embeddingStore;
        this.corpus = corpus;
        this.config = config;
    }

    public List<RetrievalCandidate> search(String query, int k, String category) {
        return search(query, k, category, config.getAlpha(), config.getThreshold());
    }

    public List<RetrievalCandidate> search(String query, int k, String category, double alpha, double threshold) {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }
        double clampedAlpha = Math.max(0.0, Math.min(1.0, alpha));

        List<EmbeddingStore.VectorHit> vectorHits = fetchVectorHits(query, k * config.getVectorFetchMultiplier());
        IndexSnapshot index = ensureIndex();
        Map<String, Double> bm25 = normalize(index.bm25().score(query, k * config.getBm25LimitMultiplier()),
                index.bm25().size());
        boolean discriminative = bm25.values().stream().anyMatch(score -> score > 0.0);
        double effectiveAlpha = discriminative ? clampedAlpha : 1.0;

        List<RetrievalCandidate> results = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int rank = 0; rank < vectorHits.size(); rank++) {
            EmbeddingStore.VectorHit hit = vectorHits.get(rank);
            // a neighbour with zero similarity is not a hit
            if (hit.similarity() <= 0.0 || !seen.add(hit.id())) {
                continue;
            }
            double lexical = bm25.getOrDefault(hit.id(), 0.0);
            RetrievalCandidate candidate = template(index, hit).toBuilder()
                    .vectorScore(hit.similarity())
                    .bm25Score(lexical)
                    .score(effectiveAlpha * hit.similarity() + (1 - effectiveAlpha) * lexical)
                    .vectorRank(rank)
                    .build();
            results.add(candidate);
        }

        if (effectiveAlpha < 1.0) {
            for (Map.Entry<String, Double> entry : bm25.entrySet()) {
                if (seen.contains(entry.getKey()) || entry.getValue() <= 0.0) {
                    continue;
                }
                RetrievalCandidate document = index.documents().get(entry.getKey());
                if (document == null) {
                    continue;
                }
                seen.add(entry.getKey());
                results.add(document.toBuilder()
                        .vectorScore(0.0)
                        .bm25Score(entry.getValue())
                        .score((1 - effectiveAlpha) * entry.getValue())
                        .vectorRank(Integer.MAX_VALUE)
                        .build());
            }
        }

        List<RetrievalCandidate> ranked = results.stream()
                .filter(candidate -> candidate.getScore() >= threshold)
                .filter(candidate -> category == null || category.equals(candidate.getCategory()))
                .sorted(Comparator.comparingDouble(RetrievalCandidate::getScore).reversed()
                        .thenComparingInt(RetrievalCandidate::getVectorRank))
                .limit(k)
                .toList();

        log.debug("[HybridRetriever] query='{}' vectorHits={} bm25Hits={} alpha={} results={}",
                abbreviate(query), vectorHits.size(), bm25.size(), effectiveAlpha, ranked.size());
        return ranked;
    }

    /**
     * Mark the lexical index stale; it is rebuilt on the next search.
     */
    public void invalidate() {
        snapshot = null;
    }

    public boolean isIndexBuilt() {
        return snapshot != null;
    }

    /**
     * Min-max normalization into [0, 1]. Documents absent from {@code raw}
     * scored zero, so the minimum is zero whenever the corpus has more
     * documents than {@code raw}. All-equal scores normalize to zero.
     */
    static Map<String, Double> normalize(Map<String, Double> raw, int corpusSize) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (raw.isEmpty()) {
            return normalized;
        }
        double max = raw.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double min = raw.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        if (raw.size() < corpusSize) {
            min = Math.min(min, 0.0);
        }
        double range = max - min;
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            normalized.put(entry.getKey(), range > 0 ? (entry.getValue() - min) / range : 0.0);
        }
        return normalized;
    }

    private List<EmbeddingStore.VectorHit> fetchVectorHits(String query, int fetchK) {
        try {
            return embeddingStore.search(query, fetchK);
        } catch (RuntimeException e) {
            log.warn("[HybridRetriever] Vector search failed, using lexical scores only: {}", e.getMessage());
            return List.of();
        }
    }

    private IndexSnapshot ensureIndex() {
        IndexSnapshot current = snapshot;
        if (current != null) {
            return current;
        }
        indexLock.lock();
        try {
            if (snapshot == null) {
                List<RetrievalCandidate> documents = corpus.get();
                Map<String, RetrievalCandidate> byId = new LinkedHashMap<>();
                List<Bm25Index.Document> indexed = new ArrayList<>(documents.size());
                for (RetrievalCandidate document : documents) {
                    byId.put(document.getId(), document);
                    indexed.add(new Bm25Index.Document(document.getId(), document.getContent()));
                }
                snapshot = new IndexSnapshot(new Bm25Index(indexed, config.getBm25K1(), config.getBm25B()), byId);
                log.debug("[HybridRetriever] BM25 index built over {} documents", documents.size());
            }
            return snapshot;
        } finally {
            indexLock.unlock();
        }
    }

    private static RetrievalCandidate template(IndexSnapshot index, EmbeddingStore.VectorHit hit) {
        RetrievalCandidate known = index.documents().get(hit.id());
        if (known != null) {
            return known;
        }
        Map<String, String> metadata = hit.metadata() != null ? hit.metadata() : Map.of();
        return RetrievalCandidate.builder()
                .id(hit.id())
                .content(metadata.getOrDefault("content", ""))
                .category(metadata.get("category"))
                .build();
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }

    private record IndexSnapshot(Bm25Index bm25, Map<String, RetrievalCandidate> documents) {
    }
}
