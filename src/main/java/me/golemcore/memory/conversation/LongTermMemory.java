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
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Durable conversational memory of one owner.
 *
 * <p>
 * Writes may be buffered: batched entries are held until
 * {@code batchSize} of them accumulate or {@code batchIntervalSeconds} pass
 * since the last flush, then written with a single durable write and a single
 * embedding call. A failed flush puts the entries back at the head of the
 * buffer.
 *
 * <p>
 * Search ranks vector neighbours by
 * {@code 0.6 similarity + 0.2 recency + 0.2 importance} (plus an optional
 * character-consistency term), normalized by the weight sum.
 */
@Slf4j
public class LongTermMemory {

    private static final double SIMILARITY_WEIGHT = 0.6;
    private static final double RECENCY_WEIGHT = 0.2;
    private static final double IMPORTANCE_WEIGHT = 0.2;
    private static final double MIN_RECENCY = 0.5;
    private static final int REPORTED_IDS_LIMIT = 200;

    private final VectorMemoryStore store;
    private final MemoryProperties.LongTermProperties config;
    private final String ownerId;
    private final Clock clock;

    private final Object bufferLock = new Object();
    private List<MemoryEntry> buffer = new ArrayList<>();
    private Instant lastFlush;

    public LongTermMemory(VectorMemoryStore store, MemoryProperties.LongTermProperties config, String ownerId,
            Clock clock) {
        this.store = store;
        this.config = config;
        this.ownerId = ownerId;
        this.clock = clock;
        this.lastFlush = clock.instant();
    }

    public void load() {
        store.load();
    }

    /**
     * Save one memory.
     *
     * @param batch
     *            buffer the write instead of writing immediately
     * @return false for duplicates and failed immediate writes
     */
    public boolean add(String content, double importance, Map<String, String> metadata, boolean batch) {
        if (content == null || content.isBlank()) {
            return false;
        }
        MemoryEntry entry = newEntry(content, importance, metadata);
        if (store.containsHash(entry.getContentHash()) || isBuffered(entry.getContentHash())) {
            log.debug("[LongTermMemory] Skipping duplicate memory {}", entry.getContentHash());
            return false;
        }
        if (batch) {
            boolean flushNow;
            synchronized (bufferLock) {
                buffer.add(entry);
                flushNow = buffer.size() >= config.getBatchSize() || isFlushDue();
            }
            if (flushNow) {
                flushBatch();
            }
            return true;
        }
        try {
            return !store.addAll(List.of(entry)).isEmpty();
        } catch (IllegalStateException e) {
            log.warn("[LongTermMemory] Failed to save memory: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Save many memories with one durable write.
     *
     * @return number saved
     */
    public int addAll(List<MemoryEntry> entries) {
        List<MemoryEntry> prepared = entries.stream()
                .filter(entry -> entry.getContent() != null && !entry.getContent().isBlank())
                .map(this::complete)
                .toList();
        try {
            int added = store.addAll(prepared).size();
            if (added > 0) {
                log.info("[LongTermMemory] Saved {} memories", added);
            }
            return added;
        } catch (IllegalStateException e) {
            log.warn("[LongTermMemory] Batch save of {} memories failed: {}", prepared.size(), e.getMessage());
            return 0;
        }
    }

    /**
     * Write the buffered memories.
     *
     * @return number written
     */
    public int flushBatch() {
        List<MemoryEntry> pending;
        synchronized (bufferLock) {
            if (buffer.isEmpty()) {
                lastFlush = clock.instant();
                return 0;
            }
            pending = buffer;
            buffer = new ArrayList<>();
        }
        try {
            int written = store.addAll(pending).size();
            synchronized (bufferLock) {
                lastFlush = clock.instant();
            }
            log.debug("[LongTermMemory] Flushed {} buffered memories", written);
            return written;
        } catch (IllegalStateException e) {
            log.warn("[LongTermMemory] Flush of {} memories failed, keeping them buffered: {}", pending.size(),
                    e.getMessage());
            synchronized (bufferLock) {
                List<MemoryEntry> restored = new ArrayList<>(pending);
                restored.addAll(buffer);
                buffer = restored;
            }
            return 0;
        }
    }

    public int flushIfDue() {
        boolean due;
        synchronized (bufferLock) {
            due = !buffer.isEmpty() && isFlushDue();
        }
        return due ? flushBatch() : 0;
    }

    public int pendingCount() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    /**
     * Most relevant memories for {@code query}. Embedding failures yield an
     * empty list.
     */
    public List<MemoryHit> search(String query, int k) {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }
        int fetch = Math.min(k * 3, config.getMaxFetch());
        List<VectorMemoryStore.Scored> neighbours;
        try {
            neighbours = store.nearest(query, fetch);
        } catch (IllegalStateException e) {
            log.warn("[LongTermMemory] Search failed: {}", e.getMessage());
            return List.of();
        }
        Instant now = clock.instant();
        double characterWeight = Math.max(0.0, Math.min(1.0, config.getCharacterWeight()));
        List<MemoryHit> hits = new ArrayList<>();
        for (VectorMemoryStore.Scored neighbour : neighbours) {
            if (neighbour.similarity() < config.getMinSimilarity()) {
                continue;
            }
            MemoryEntry entry = neighbour.entry();
            double recency = recency(entry.getCreatedAt(), now);
            double numerator = neighbour.similarity() * SIMILARITY_WEIGHT + recency * RECENCY_WEIGHT
                    + entry.getImportance() * IMPORTANCE_WEIGHT;
            double denominator = SIMILARITY_WEIGHT + RECENCY_WEIGHT + IMPORTANCE_WEIGHT;
            Double consistency = entry.getCharacterConsistency();
            if (characterWeight > 0 && consistency != null && consistency >= 0 && consistency <= 1) {
                numerator += consistency * characterWeight;
                denominator += characterWeight;
            }
            hits.add(new MemoryHit(entry, neighbour.similarity(), recency, numerator / denominator));
        }
        hits.sort(Comparator.comparingDouble(MemoryHit::finalScore).reversed());
        return hits.size() > k ? new ArrayList<>(hits.subList(0, k)) : hits;
    }

    /**
     * Recency factor: 1.0 inside {@code noDecayDays}, then a linear decline
     * over a year, never below 0.5.
     */
    double recency(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return 1.0;
        }
        double ageDays = Math.max(0.0, Duration.between(createdAt, now).toSeconds() / 86400.0);
        if (ageDays <= config.getNoDecayDays()) {
            return 1.0;
        }
        return Math.max(MIN_RECENCY, 1.0 - (ageDays - config.getNoDecayDays()) / 365.0);
    }

    /**
     * Every stored memory, buffered ones included.
     */
    public List<MemoryEntry> export() {
        flushBatch();
        return store.all();
    }

    /**
     * Import exported memories with one durable write.
     *
     * @param overwrite
     *            clear existing memories first; otherwise ids and contents
     *            already present are skipped, which makes repeated imports
     *            no-ops
     * @return number imported
     */
    public int importRecords(List<MemoryEntry> records, boolean overwrite) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        if (overwrite) {
            clear();
        }
        int imported = addAll(records);
        log.info("[LongTermMemory] Imported {} of {} memories (overwrite={})", imported, records.size(),
                overwrite);
        return imported;
    }

    /**
     * Retention pass. Memories older than {@code maxAgeDays} are dropped,
     * then the unprotected remainder is cut to {@code maxItems}, least
     * important and oldest first. Memories with importance at or above
     * {@code preserveImportanceAbove} are never dropped.
     *
     * @param maxItems
     *            null for no count limit
     * @param maxAgeDays
     *            null for no age limit
     */
    public PruneReport prune(Integer maxItems, Integer maxAgeDays, double preserveImportanceAbove,
            boolean dryRun) {
        flushBatch();
        List<MemoryEntry> all = store.all();
        double preserve = Math.max(0.0, Math.min(1.0, preserveImportanceAbove));
        Instant cutoff = maxAgeDays != null ? clock.instant().minus(Duration.ofDays(Math.max(0, maxAgeDays))) : null;

        Set<String> protectedIds = new HashSet<>();
        Set<String> toDelete = new HashSet<>();
        List<MemoryEntry> candidates = new ArrayList<>();
        for (MemoryEntry entry : all) {
            if (entry.getImportance() >= preserve) {
                protectedIds.add(entry.getId());
                continue;
            }
            if (cutoff != null && entry.getCreatedAt() != null && entry.getCreatedAt().isBefore(cutoff)) {
                toDelete.add(entry.getId());
                continue;
            }
            candidates.add(entry);
        }
        if (maxItems != null) {
            int allowance = Math.max(0, maxItems - protectedIds.size());
            candidates.sort(Comparator.comparingDouble(MemoryEntry::getImportance).reversed()
                    .thenComparing(entry -> entry.getCreatedAt() != null ? entry.getCreatedAt() : Instant.EPOCH,
                            Comparator.reverseOrder()));
            for (int i = allowance; i < candidates.size(); i++) {
                toDelete.add(candidates.get(i).getId());
            }
        }

        int deleted = 0;
        if (!dryRun && !toDelete.isEmpty()) {
            deleted = store.delete(toDelete);
            log.info("[LongTermMemory] Pruned {} memories", deleted);
        }
        List<String> reported = toDelete.stream().sorted().limit(REPORTED_IDS_LIMIT).collect(Collectors.toList());
        return new PruneReport(dryRun, all.size(), deleted, protectedIds.size(), toDelete.size(), reported);
    }

    public void clear() {
        synchronized (bufferLock) {
            buffer = new ArrayList<>();
        }
        store.clear();
        log.info("[LongTermMemory] Cleared memories of {}", ownerId);
    }

    public int count() {
        return store.count();
    }

    public long writeVersion() {
        return store.writeVersion();
    }

    private boolean isFlushDue() {
        int interval = config.getBatchIntervalSeconds();
        return interval > 0 && !clock.instant().isBefore(lastFlush.plusSeconds(interval));
    }

    private boolean isBuffered(String hash) {
        synchronized (bufferLock) {
            return buffer.stream().anyMatch(entry -> hash.equals(entry.getContentHash()));
        }
    }

    private MemoryEntry newEntry(String content, double importance, Map<String, String> metadata) {
        Map<String, String> copy = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        Double consistency = null;
        String rawConsistency = copy.remove("character_consistency");
        if (rawConsistency != null) {
            try {
                consistency = Double.parseDouble(rawConsistency);
            } catch (NumberFormatException e) {
                log.debug("[LongTermMemory] Ignoring malformed character consistency '{}'", rawConsistency);
            }
        }
        return MemoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .content(content)
                .ownerId(ownerId)
                .createdAt(clock.instant())
                .importance(Math.max(0.0, Math.min(1.0, importance)))
                .contentHash(ContentHash.of(content))
                .characterConsistency(consistency)
                .metadata(copy)
                .build();
    }

    private MemoryEntry complete(MemoryEntry entry) {
        MemoryEntry.MemoryEntryBuilder builder = entry.toBuilder();
        if (entry.getId() == null || entry.getId().isBlank()) {
            builder.id(UUID.randomUUID().toString());
        }
        if (entry.getOwnerId() == null) {
            builder.ownerId(ownerId);
        }
        if (entry.getCreatedAt() == null) {
            builder.createdAt(clock.instant());
        }
        if (entry.getContentHash() == null) {
            builder.contentHash(ContentHash.of(entry.getContent()));
        }
        if (entry.getMetadata() == null) {
            builder.metadata(new LinkedHashMap<>());
        }
        return builder.build();
    }

    /**
     * Scored search hit.
     */
    public record MemoryHit(MemoryEntry entry, double similarity, double recency, double finalScore) {
    }

    public record PruneReport(boolean dryRun, int totalBefore, int deleted, int protectedCount, int wouldDelete,
            List<String> wouldDeleteIds) {
    }
}
