package me.golemcore.memory.domain.service;

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

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.cache.CacheLayer;
import me.golemcore.memory.conversation.CoreMemory;
import me.golemcore.memory.conversation.DiaryMemory;
import me.golemcore.memory.conversation.LongTermMemory;
import me.golemcore.memory.conversation.MemoryManager;
import me.golemcore.memory.graph.KnowledgeGraph;
import me.golemcore.memory.knowledge.KnowledgeBase;
import me.golemcore.memory.recommend.KnowledgeRecommender;
import me.golemcore.memory.recommend.KnowledgeUsageTracker;
import me.golemcore.memory.recommend.ProactiveKnowledgePusher;
import me.golemcore.memory.retrieval.ConcurrentRetriever;

/**
 * Everything that belongs to one owner: stores, caches, breakers and locks.
 * Nothing here is shared between owners.
 */
@Getter
@Builder
@Slf4j
public class OwnerMemoryContext {

    private final String ownerId;
    private final MemoryManager memoryManager;
    private final LongTermMemory longTerm;
    private final CoreMemory coreMemory;
    private final DiaryMemory diary;
    private final KnowledgeBase knowledgeBase;
    private final KnowledgeGraph graph;
    private final CacheLayer cache;
    private final ConcurrentRetriever retriever;
    private final KnowledgeRecommender recommender;
    private final ProactiveKnowledgePusher pusher;
    private final KnowledgeUsageTracker usageTracker;

    /**
     * Write buffered state whose threshold or interval has been reached.
     */
    public void flushDue() {
        longTerm.flushIfDue();
        knowledgeBase.flushUsageIfDue();
        usageTracker.flush();
    }

    /**
     * Write every buffered change regardless of thresholds.
     */
    public void flushAll() {
        try {
            longTerm.flushBatch();
            knowledgeBase.flushUsage();
            usageTracker.flush();
            graph.flush();
        } catch (IllegalStateException e) {
            log.warn("[MemoryEngine] Final flush for {} failed: {}", ownerId, e.getMessage());
        }
    }
}
