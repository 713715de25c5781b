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
import me.golemcore.memory.domain.model.ChatMessage;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.task.BackgroundTaskQueue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Conversation memory of one owner: the short-term window plus durable
 * long-term memory, with importance-based consolidation between them.
 *
 * <p>
 * Exchanges scoring below {@code skipBelow} are never stored long-term.
 * Every {@code autoEvery} interactions a consolidation pass runs on the
 * background queue and promotes exchanges scoring at least
 * {@code promoteThreshold}.
 */
@Slf4j
public class MemoryManager {

    private final ShortTermMemory shortTerm;
    private final LongTermMemory longTerm;
    private final MemoryDeduplicator deduplicator;
    private final MemoryProperties.ConsolidationProperties config;
    private final BackgroundTaskQueue taskQueue;
    private final Clock clock;

    private final AtomicInteger interactionsSinceConsolidation = new AtomicInteger();
    private final AtomicBoolean consolidating = new AtomicBoolean();

    public MemoryManager(ShortTermMemory shortTerm, LongTermMemory longTerm, MemoryDeduplicator deduplicator,
            MemoryProperties.ConsolidationProperties config, BackgroundTaskQueue taskQueue, Clock clock) {
        this.shortTerm = shortTerm;
        this.longTerm = longTerm;
        this.deduplicator = deduplicator;
        this.config = config;
        this.taskQueue = taskQueue;
        this.clock = clock;
    }

    /**
     * Record an exchange in the short-term window and, if requested, in
     * long-term memory.
     *
     * @param importance
     *            null to estimate it
     */
    public void addInteraction(String userMessage, String assistantMessage, boolean saveToLongTerm,
            Double importance) {
        shortTerm.addInteraction(userMessage, assistantMessage);
        if (saveToLongTerm) {
            addInteractionLongTerm(userMessage, assistantMessage, importance);
        }
        if (config.isAutoEnabled()
                && interactionsSinceConsolidation.incrementAndGet() >= Math.max(1, config.getAutoEvery())) {
            interactionsSinceConsolidation.set(0);
            scheduleConsolidation();
        }
    }

    /**
     * Store an exchange in long-term memory only.
     *
     * @return whether it was stored or buffered
     */
    public boolean addInteractionLongTerm(String userMessage, String assistantMessage, Double importance) {
        double effective = importance != null ? importance
                : ImportanceEstimator.estimate(userMessage, assistantMessage);
        String interaction = format(userMessage, assistantMessage);
        if (effective < config.getSkipBelow()) {
            log.debug("[MemoryManager] Skipping low-importance exchange ({})", effective);
            return false;
        }
        String hash = deduplicator.contentHash(interaction);
        if (deduplicator.containsHash(hash)) {
            log.debug("[MemoryManager] Skipping duplicate exchange");
            return false;
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("type", "conversation");
        boolean stored = longTerm.add(interaction, effective, metadata, true);
        if (stored) {
            deduplicator.addHash(hash);
        }
        return stored;
    }

    /**
     * Promote important exchanges of the short-term window to long-term
     * memory with one batch write.
     *
     * @return number of memories written
     */
    public int consolidate() {
        List<ChatMessage> messages = shortTerm.getMessages();
        List<MemoryEntry> promoted = new ArrayList<>();
        List<String> hashes = new ArrayList<>();
        int i = 0;
        while (i < messages.size() - 1) {
            ChatMessage user = messages.get(i);
            ChatMessage assistant = messages.get(i + 1);
            if (!ChatMessage.USER.equals(user.role()) || !ChatMessage.ASSISTANT.equals(assistant.role())) {
                i++;
                continue;
            }
            i += 2;
            double importance = ImportanceEstimator.estimate(user.content(), assistant.content());
            if (importance < config.getPromoteThreshold()) {
                continue;
            }
            String content = format(user.content(), assistant.content());
            String hash = deduplicator.contentHash(content);
            if (deduplicator.containsHash(hash) || hashes.contains(hash)) {
                continue;
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("type", "conversation");
            metadata.put("consolidated", "true");
            promoted.add(MemoryEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .content(content)
                    .createdAt(clock.instant())
                    .importance(importance)
                    .contentHash(hash)
                    .metadata(metadata)
                    .build());
            hashes.add(hash);
        }
        if (promoted.isEmpty()) {
            return 0;
        }
        int written = longTerm.addAll(promoted);
        if (written == promoted.size()) {
            deduplicator.addHashes(hashes);
        }
        if (written > 0) {
            log.info("[MemoryManager] Consolidated {} exchanges into long-term memory", written);
        }
        return written;
    }

    /**
     * Contents of the most relevant long-term memories.
     */
    public List<String> searchMemories(String query, int k) {
        return longTerm.search(query, k).stream()
                .map(hit -> hit.entry().getContent())
                .toList();
    }

    public List<ChatMessage> recentMessages() {
        return shortTerm.getMessages();
    }

    public Stats stats() {
        return new Stats(shortTerm.size(), shortTerm.version(), longTerm.count(), longTerm.pendingCount(),
                longTerm.writeVersion(), deduplicator.size());
    }

    public void clearAll() {
        shortTerm.clear();
        longTerm.clear();
        deduplicator.clear();
    }

    public ShortTermMemory getShortTerm() {
        return shortTerm;
    }

    public LongTermMemory getLongTerm() {
        return longTerm;
    }

    private void scheduleConsolidation() {
        if (!consolidating.compareAndSet(false, true)) {
            return;
        }
        BackgroundTaskQueue.Outcome outcome = taskQueue.submit("consolidation", () -> {
            try {
                consolidate();
            } finally {
                consolidating.set(false);
            }
        }, BackgroundTaskQueue.Overflow.DROP);
        if (outcome == BackgroundTaskQueue.Outcome.DROPPED) {
            consolidating.set(false);
        }
    }

    private String format(String userMessage, String assistantMessage) {
        return config.getUserLabel() + ": " + userMessage + "\n" + config.getAssistantLabel() + ": "
                + assistantMessage;
    }

    public record Stats(int shortTermMessages, long shortTermVersion, int longTermMemories,
            int pendingLongTermWrites, long longTermVersion, int knownHashes) {
    }
}
