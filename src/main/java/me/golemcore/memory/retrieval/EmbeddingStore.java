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
import me.golemcore.memory.infrastructure.config.MemoryProperties.DistanceMetric;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorIndexPort;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * One vector collection of an owner: embeds documents and queries through the
 * {@link EmbeddingPort} and stores/searches them in the
 * {@link VectorIndexPort}.
 *
 * <p>
 * Distances are converted to similarities according to the configured
 * {@link DistanceMetric}. Without an embedding backend the store is a no-op
 * and searches return nothing.
 */
@Slf4j
public class EmbeddingStore {

    private final EmbeddingPort embeddingPort;
    private final VectorIndexPort vectorIndex;
    private final String collection;
    private final DistanceMetric distanceMetric;

    public EmbeddingStore(EmbeddingPort embeddingPort, VectorIndexPort vectorIndex, String collection,
            DistanceMetric distanceMetric) {
        this.embeddingPort = embeddingPort;
        this.vectorIndex = vectorIndex;
        this.collection = collection;
        this.distanceMetric = distanceMetric;
    }

    public boolean isAvailable() {
        return embeddingPort.isAvailable();
    }

    /**
     * Index documents in one embedding batch, falling back to one call per
     * document when the batch fails.
     *
     * @return number of documents indexed
     */
    public int index(List<VectorDocument> documents) {
        if (documents.isEmpty() || !isAvailable()) {
            return 0;
        }
        try {
            List<float[]> vectors = embeddingPort.embedBatch(documents.stream().map(VectorDocument::text).toList())
                    .join();
            List<VectorIndexPort.VectorRecord> records = new ArrayList<>(documents.size());
            for (int i = 0; i < documents.size(); i++) {
                VectorDocument document = documents.get(i);
                records.add(new VectorIndexPort.VectorRecord(document.id(), vectors.get(i), document.metadata()));
            }
            vectorIndex.upsert(collection, records);
            return records.size();
        } catch (CompletionException | IndexOutOfBoundsException e) {
            log.warn("[EmbeddingStore] Batch indexing of {} documents failed in {}, indexing one by one: {}",
                    documents.size(), collection, e.getMessage());
            int indexed = 0;
            for (VectorDocument document : documents) {
                if (indexOne(document)) {
                    indexed++;
                }
            }
            return indexed;
        }
    }

    /**
     * Nearest documents to {@code query}, most similar first.
     *
     * @throws IllegalStateException
     *             when the embedding backend fails
     */
    public List<VectorHit> search(String query, int k) {
        if (k <= 0 || !isAvailable() || vectorIndex.count(collection) == 0) {
            return List.of();
        }
        float[] queryVector;
        try {
            queryVector = embeddingPort.embed(query).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Query embedding failed", e.getCause());
        }
        return vectorIndex.search(collection, queryVector, k).stream()
                .map(match -> new VectorHit(match.id(), toSimilarity(match.distance()), match.metadata()))
                .toList();
    }

    public void delete(Collection<String> ids) {
        if (!ids.isEmpty()) {
            vectorIndex.delete(collection, ids);
        }
    }

    public void clear() {
        vectorIndex.clear(collection);
    }

    public int count() {
        return vectorIndex.count(collection);
    }

    public String getCollection() {
        return collection;
    }

    /**
     * Monotonic distance-to-similarity conversion; smaller distance always
     * maps to a larger similarity.
     */
    public double toSimilarity(double distance) {
        return switch (distanceMetric) {
        case BOUNDED -> Math.max(0.0, Math.min(1.0, 1.0 - distance));
        case UNBOUNDED -> 1.0 / (1.0 + Math.max(0.0, distance));
        };
    }

    private boolean indexOne(VectorDocument document) {
        try {
            float[] vector = embeddingPort.embed(document.text()).join();
            vectorIndex.upsert(collection,
                    List.of(new VectorIndexPort.VectorRecord(document.id(), vector, document.metadata())));
            return true;
        } catch (CompletionException e) {
            log.warn("[EmbeddingStore] Failed to index document {}: {}", document.id(), e.getMessage());
            return false;
        }
    }

    public record VectorDocument(String id, String text, Map<String, String> metadata) {
    }

    public record VectorHit(String id, double similarity, Map<String, String> metadata) {
    }
}
