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
import me.golemcore.memory.text.ContentHash;
import me.golemcore.memory.text.TextSimilarity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Content-hash and character-similarity deduplication of conversational
 * memories.
 *
 * <p>
 * Seen hashes live in a bounded FIFO set: once {@code maxSeenHashes} is
 * reached the oldest hash is forgotten. {@code maxSeenHashes <= 0} means
 * unbounded.
 */
@Slf4j
public class MemoryDeduplicator {

    private final double similarityThreshold;
    private final int maxSeenHashes;
    private final LinkedHashSet<String> seenHashes = new LinkedHashSet<>();

    public MemoryDeduplicator(double similarityThreshold, int maxSeenHashes) {
        this.similarityThreshold = similarityThreshold;
        this.maxSeenHashes = maxSeenHashes;
    }

    public String contentHash(String content) {
        return ContentHash.of(content);
    }

    public synchronized boolean containsHash(String hash) {
        return hash != null && !hash.isEmpty() && seenHashes.contains(hash);
    }

    /**
     * @return false if the hash was already known
     */
    public synchronized boolean addHash(String hash) {
        if (hash == null || hash.isEmpty() || seenHashes.contains(hash)) {
            return false;
        }
        seenHashes.add(hash);
        evictOverflow();
        return true;
    }

    public synchronized int addHashes(Collection<String> hashes) {
        int added = 0;
        for (String hash : hashes) {
            if (addHash(hash)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Record {@code content} unless it was seen before.
     *
     * @return true for new content, false for a duplicate
     */
    public boolean checkAndAdd(String content) {
        return addHash(contentHash(content));
    }

    public boolean isDuplicate(String content) {
        return containsHash(contentHash(content));
    }

    public synchronized int size() {
        return seenHashes.size();
    }

    public synchronized void clear() {
        seenHashes.clear();
    }

    public double similarity(String left, String right) {
        return TextSimilarity.characterJaccard(left, right);
    }

    /**
     * Entries of {@code existing} at least {@code similarityThreshold} similar
     * to {@code content}.
     */
    public List<SimilarMemory> findSimilar(String content, List<MemoryEntry> existing) {
        List<SimilarMemory> similar = new ArrayList<>();
        for (int i = 0; i < existing.size(); i++) {
            double score = similarity(content, existing.get(i).getContent());
            if (score >= similarityThreshold) {
                similar.add(new SimilarMemory(i, score));
            }
        }
        return similar;
    }

    /**
     * Merge two similar memories: the more important one is kept, usage
     * counts are summed and importance is averaged.
     */
    public MemoryEntry merge(MemoryEntry first, MemoryEntry second) {
        MemoryEntry base = first.getImportance() >= second.getImportance() ? first : second;
        MemoryEntry other = base == first ? second : first;
        Map<String, String> metadata = new LinkedHashMap<>(base.getMetadata() != null ? base.getMetadata() : Map.of());
        metadata.put("merged_from", other.getId() != null ? other.getId() : other.getContentHash());
        return base.toBuilder()
                .usageCount(first.getUsageCount() + second.getUsageCount())
                .importance((first.getImportance() + second.getImportance()) / 2.0)
                .metadata(metadata)
                .build();
    }

    private void evictOverflow() {
        if (maxSeenHashes <= 0) {
            return;
        }
        Iterator<String> oldest = seenHashes.iterator();
        while (seenHashes.size() > maxSeenHashes && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    public record SimilarMemory(int index, double similarity) {
    }
}
