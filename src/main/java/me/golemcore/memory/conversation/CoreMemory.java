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
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.text.ContentHash;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Small store of stable facts about the user (address, hobbies, likes),
 * matched semantically. Each fact carries a category such as
 * {@code personal_info} or {@code preferences}.
 */
@Slf4j
public class CoreMemory {

    public static final String DEFAULT_CATEGORY = "general";
    private static final String CATEGORY_KEY = "category";

    private final VectorMemoryStore store;
    private final MemoryProperties.CoreMemoryProperties config;
    private final String ownerId;
    private final Clock clock;

    public CoreMemory(VectorMemoryStore store, MemoryProperties.CoreMemoryProperties config, String ownerId,
            Clock clock) {
        this.store = store;
        this.config = config;
        this.ownerId = ownerId;
        this.clock = clock;
    }

    public void load() {
        store.load();
    }

    /**
     * @return false when the fact is already known or the write failed
     */
    public boolean add(String content, String category, double importance) {
        if (content == null || content.isBlank()) {
            return false;
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(CATEGORY_KEY, category != null ? category : DEFAULT_CATEGORY);
        metadata.put("type", "core_memory");
        MemoryEntry entry = MemoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .content(content)
                .ownerId(ownerId)
                .createdAt(clock.instant())
                .importance(Math.max(0.0, Math.min(1.0, importance)))
                .contentHash(ContentHash.of(content))
                .metadata(metadata)
                .build();
        try {
            boolean added = !store.addAll(List.of(entry)).isEmpty();
            if (added) {
                log.info("[CoreMemory] Added [{}] fact", metadata.get(CATEGORY_KEY));
            }
            return added;
        } catch (IllegalStateException e) {
            log.warn("[CoreMemory] Failed to save fact: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Facts similar to {@code query}, optionally limited to one category.
     * Embedding failures yield an empty list.
     */
    public List<CoreHit> search(String query, int k, String category) {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }
        List<VectorMemoryStore.Scored> neighbours;
        try {
            neighbours = store.nearest(query, k * 2);
        } catch (IllegalStateException e) {
            log.warn("[CoreMemory] Search failed: {}", e.getMessage());
            return List.of();
        }
        List<CoreHit> hits = new ArrayList<>();
        for (VectorMemoryStore.Scored neighbour : neighbours) {
            if (neighbour.similarity() < config.getMinSimilarity()) {
                continue;
            }
            if (category != null && !category.equals(categoryOf(neighbour.entry()))) {
                continue;
            }
            hits.add(new CoreHit(neighbour.entry(), neighbour.similarity()));
            if (hits.size() >= k) {
                break;
            }
        }
        return hits;
    }

    public List<MemoryEntry> all() {
        return store.all();
    }

    public int importRecords(List<MemoryEntry> records, boolean overwrite) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        if (overwrite) {
            store.clear();
        }
        try {
            return store.addAll(records.stream()
                    .filter(entry -> entry.getContent() != null && !entry.getContent().isBlank())
                    .map(entry -> entry.toBuilder()
                            .id(entry.getId() != null ? entry.getId() : UUID.randomUUID().toString())
                            .ownerId(ownerId)
                            .createdAt(entry.getCreatedAt() != null ? entry.getCreatedAt() : clock.instant())
                            .build())
                    .toList()).size();
        } catch (IllegalStateException e) {
            log.warn("[CoreMemory] Import failed: {}", e.getMessage());
            return 0;
        }
    }

    public void clear() {
        store.clear();
    }

    public int count() {
        return store.count();
    }

    public long writeVersion() {
        return store.writeVersion();
    }

    public boolean isAvailable() {
        return store.isSearchable();
    }

    private static String categoryOf(MemoryEntry entry) {
        return entry.getMetadata() != null ? entry.getMetadata().getOrDefault(CATEGORY_KEY, DEFAULT_CATEGORY)
                : DEFAULT_CATEGORY;
    }

    public record CoreHit(MemoryEntry entry, double similarity) {
    }
}
