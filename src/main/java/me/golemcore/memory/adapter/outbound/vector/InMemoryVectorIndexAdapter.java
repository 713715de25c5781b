package me.golemcore.memory.adapter.outbound.vector;

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
import me.golemcore.memory.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process vector index: exact cosine search over every stored vector.
 *
 * <p>
 * Distances are reported as {@code 1 - cosine}, clamped to [0, 1], so the
 * bounded similarity conversion applies. Collections are created on first
 * write.
 *
 * <p>
 * Thread-safe implementation using {@link ConcurrentHashMap}.
 */
@Component
@Slf4j
public class InMemoryVectorIndexAdapter implements VectorIndexPort {

    private final Map<String, Map<String, VectorRecord>> collections = new ConcurrentHashMap<>();

    @Override
    public void upsert(String collection, List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        Map<String, VectorRecord> target = collections.computeIfAbsent(collection,
                name -> new ConcurrentHashMap<>());
        for (VectorRecord vectorRecord : records) {
            target.put(vectorRecord.id(), vectorRecord);
        }
        log.debug("[VectorIndex] Upserted {} vectors into {}", records.size(), collection);
    }

    @Override
    public List<VectorMatch> search(String collection, float[] query, int k) {
        Map<String, VectorRecord> records = collections.get(collection);
        if (records == null || records.isEmpty() || k <= 0) {
            return List.of();
        }

        List<VectorMatch> matches = new ArrayList<>(records.size());
        for (VectorRecord vectorRecord : records.values()) {
            if (vectorRecord.vector().length != query.length) {
                continue;
            }
            double distance = 1.0 - cosineSimilarity(query, vectorRecord.vector());
            matches.add(new VectorMatch(vectorRecord.id(), Math.max(0.0, Math.min(1.0, distance)),
                    vectorRecord.metadata()));
        }

        return matches.stream()
                .sorted(Comparator.comparingDouble(VectorMatch::distance).thenComparing(VectorMatch::id))
                .limit(k)
                .toList();
    }

    @Override
    public void delete(String collection, Collection<String> ids) {
        Map<String, VectorRecord> records = collections.get(collection);
        if (records != null) {
            ids.forEach(records::remove);
        }
    }

    @Override
    public void clear(String collection) {
        collections.remove(collection);
    }

    @Override
    public int count(String collection) {
        Map<String, VectorRecord> records = collections.get(collection);
        return records != null ? records.size() : 0;
    }

    static double cosineSimilarity(float[] a, float[] b) {
        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
