package me.golemcore.memory.conversation;

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
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.persistence.JsonDocumentStore;
import me.golemcore.memory.retrieval.EmbeddingStore;
import me.golemcore.memory.text.ContentHash;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, vector-indexed set of {@link MemoryEntry} records shared by long-term
 * and core memory.
 *
 * <p>
 * The JSON document is authoritative; the vector index is rebuilt from it on
 * {@link #load()}. Entries are unique by id and by content hash. Every
 * successful write bumps {@link #writeVersion()}.
 */
@Slf4j
public class VectorMemoryStore {

    private final JsonDocumentStore<List<MemoryEntry>> document;
    private final EmbeddingStore embeddings;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong writeVersion = new AtomicLong();

    private final Map<String, MemoryEntry> entries = new LinkedHashMap<>();
    private final Map<String, String> idByHash = new HashMap<>();

    public VectorMemoryStore(JsonDocumentStore<List<MemoryEntry>> document, EmbeddingStore embeddings) {
        this.document = document;
        this.embeddings = embeddings;
    }

    public void load() {
        lock.lock();
        try {
            entries.clear();
            idByHash.clear();
            for (MemoryEntry entry : document.load()) {
                if (entry == null || entry.getId() == null || entry.getContent() == null) {
                    continue;
                }
                if (entry.getContentHash() == null) {
                    entry.setContentHash(ContentHash.of(entry.getContent()));
                }
                entries.put(entry.getId(), entry);
                idByHash.putIfAbsent(entry.getContentHash(), entry.getId());
            }
            embeddings.clear();
            int indexed = embeddings.index(toDocuments(entries.values()));
            log.info("[MemoryStore] Loaded {} entries from {}, {} indexed", entries.size(),
                    document.getFileName(), indexed);
        } finally {
            lock.unlock();
        }
    }

    public boolean containsHash(String hash) {
        lock.lock();
        try {
            return idByHash.containsKey(hash);
        } finally {
            lock.unlock();
        }
    }

    public boolean containsId(String id) {
        lock.lock();
        try {
            return entries.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add entries with one durable write and one index call. Entries whose id
     * or content hash is already present are skipped.
     *
     * @return entries actually added
     * @throws IllegalStateException
     *             when the durable write fails; nothing is added then
     */
    public List<MemoryEntry> addAll(List<MemoryEntry> candidates) {
        lock.lock();
        try {
            List<MemoryEntry> added = new ArrayList<>();
            for (MemoryEntry entry : candidates) {
                String hash = entry.getContentHash() != null ? entry.getContentHash()
                        : ContentHash.of(entry.getContent());
                entry.setContentHash(hash);
                if (entries.containsKey(entry.getId()) || idByHash.containsKey(hash)) {
                    continue;
                }
                entries.put(entry.getId(), entry);
                idByHash.put(hash, entry.getId());
                added.add(entry);
            }
            if (added.isEmpty()) {
                return added;
            }
            try {
                persist();
            } catch (IllegalStateException e) {
                for (MemoryEntry entry : added) {
                    entries.remove(entry.getId());
                    idByHash.remove(entry.getContentHash());
                }
                throw e;
            }
            embeddings.index(toDocuments(added));
            writeVersion.incrementAndGet();
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nearest entries to {@code query} with their similarity, most similar
     * first.
     *
     * @throws IllegalStateException
     *             when the embedding backend fails
     */
    public List<Scored> nearest(String query, int k) {
        List<EmbeddingStore.VectorHit> hits = embeddings.search(query, k);
        lock.lock();
        try {
            List<Scored> scored = new ArrayList<>(hits.size());
            for (EmbeddingStore.VectorHit hit : hits) {
                MemoryEntry entry = entries.get(hit.id());
                if (entry != null) {
                    scored.add(new Scored(entry, hit.similarity()));
                }
            }
            return scored;
        } finally {
            lock.unlock();
        }
    }

    public Optional<MemoryEntry> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(id));
        } finally {
            lock.unlock();
        }
    }

    public List<MemoryEntry> all() {
        lock.lock();
        try {
            return entries.values().stream().map(entry -> entry.toBuilder()
                    .metadata(new LinkedHashMap<>(entry.getMetadata() != null ? entry.getMetadata() : Map.of()))
                    .build()).toList();
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int delete(Collection<String> ids) {
        lock.lock();
        try {
            List<String> removed = new ArrayList<>();
            for (String id : ids) {
                MemoryEntry entry = entries.remove(id);
                if (entry != null) {
                    idByHash.remove(entry.getContentHash());
                    removed.add(id);
                }
            }
            if (removed.isEmpty()) {
                return 0;
            }
            persist();
            embeddings.delete(removed);
            writeVersion.incrementAndGet();
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            idByHash.clear();
            persist();
            embeddings.clear();
            writeVersion.incrementAndGet();
        } finally {
            lock.unlock();
        }
    }

    public long writeVersion() {
        return writeVersion.get();
    }

    public boolean isSearchable() {
        return embeddings.isAvailable();
    }

    private void persist() {
        document.save(new ArrayList<>(entries.values()));
    }

    private static List<EmbeddingStore.VectorDocument> toDocuments(Collection<MemoryEntry> entries) {
        List<EmbeddingStore.VectorDocument> documents = new ArrayList<>(entries.size());
        for (MemoryEntry entry : entries) {
            Map<String, String> metadata = new HashMap<>();
            metadata.put("content", entry.getContent());
            if (entry.getMetadata() != null && entry.getMetadata().get("category") != null) {
                metadata.put("category", entry.getMetadata().get("category"));
            }
            documents.add(new EmbeddingStore.VectorDocument(entry.getId(), entry.getContent(), metadata));
        }
        return documents;
    }

    /**
     * Entry with its vector similarity to a query.
     */
    public record Scored(MemoryEntry entry, double similarity) {
    }
}
