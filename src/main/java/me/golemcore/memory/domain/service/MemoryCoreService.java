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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.cache.CacheLayer;
import me.golemcore.memory.conversation.DiaryCandidate;
import me.golemcore.memory.conversation.DiaryDecision;
import me.golemcore.memory.conversation.MemoryManager;
import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.RelatedKnowledge;
import me.golemcore.memory.graph.GraphStatistics;
import me.golemcore.memory.knowledge.ImportReport;
import me.golemcore.memory.knowledge.KnowledgeHit;
import me.golemcore.memory.knowledge.KnowledgeStatistics;
import me.golemcore.memory.recommend.ProactiveKnowledgePusher;
import me.golemcore.memory.recommend.PushedKnowledge;
import me.golemcore.memory.recommend.Recommendation;
import me.golemcore.memory.recommend.RecommendationContext;
import me.golemcore.memory.recommend.UsageStatistics;
import me.golemcore.memory.recommend.UsageType;
import me.golemcore.memory.retrieval.ConcurrentRetriever;
import me.golemcore.memory.task.BackgroundTaskQueue;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the memory core for the agent and GUI layers.
 *
 * <p>
 * Every operation is scoped to an owner id; the owner's stores are opened on
 * first use through {@link MemoryEngineRegistry}. Searches never fail because
 * a backend is down: missing embedding or completion backends degrade to
 * lexical and rule-based paths, and failing retrieval sources contribute
 * nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryCoreService {

    private static final List<String> MEMORY_SOURCES = List.of(OwnerContextFactory.SOURCE_CORE,
            OwnerContextFactory.SOURCE_LONG_TERM, OwnerContextFactory.SOURCE_DIARY);

    private final MemoryEngineRegistry registry;
    private final BackgroundTaskQueue taskQueue;

    // ==================== Conversation ====================

    public void addInteraction(String ownerId, String userMessage, String assistantMessage, boolean saveToLongTerm,
            Double importance) {
        registry.get(ownerId).getMemoryManager().addInteraction(userMessage, assistantMessage, saveToLongTerm,
                importance);
    }

    public boolean addCoreMemory(String ownerId, String content, String category, double importance) {
        return registry.get(ownerId).getCoreMemory().add(content, category, importance);
    }

    public DiaryDecision addDiaryEntry(String ownerId, DiaryCandidate candidate) {
        return registry.get(ownerId).getDiary().addEntry(candidate);
    }

    public Optional<DiaryEntry> generateDailySummary(String ownerId, boolean force) {
        return registry.get(ownerId).getDiary().generateDailySummary(force);
    }

    /**
     * Texts of the memories most relevant to a query, core facts first, then
     * long-term memories, then diary entries.
     */
    public List<String> searchMemories(String ownerId, String query, int k) {
        requireNonNegative(k);
        if (k == 0) {
            return List.of();
        }
        Map<String, Integer> perSourceK = new LinkedHashMap<>();
        MEMORY_SOURCES.forEach(source -> perSourceK.put(source, k));
        perSourceK.put(OwnerContextFactory.SOURCE_KNOWLEDGE, 0);

        Map<String, List<String>> results = retrieve(ownerId, query, perSourceK);
        Set<String> merged = new LinkedHashSet<>();
        for (String source : MEMORY_SOURCES) {
            merged.addAll(results.getOrDefault(source, List.of()));
        }
        return merged.stream().limit(k).toList();
    }

    /**
     * Raw fan-out over every memory source of the owner.
     */
    public Map<String, List<String>> retrieve(String ownerId, String query, Map<String, Integer> perSourceK) {
        return registry.get(ownerId).getRetriever().retrieve(query, perSourceK, true);
    }

    // ==================== Knowledge ====================

    public List<KnowledgeHit> searchKnowledge(String ownerId, String query, int k, String category) {
        requireNonNegative(k);
        OwnerMemoryContext context = registry.get(ownerId);
        List<KnowledgeHit> hits = context.getKnowledgeBase().search(query, k, category);
        RecommendationContext usage = RecommendationContext.ofQuery(query);
        hits.forEach(hit -> context.getUsageTracker().recordUsage(hit.entry().getId(), usage, UsageType.SEARCH));
        return hits;
    }

    public String addKnowledge(String ownerId, KnowledgeEntry draft) {
        return registry.get(ownerId).getKnowledgeBase().add(draft);
    }

    public List<String> learnFromText(String ownerId, String text, String category, String source) {
        return registry.get(ownerId).getKnowledgeBase().learnFromText(text, category, source);
    }

    public boolean updateKnowledge(String ownerId, String id, KnowledgeEntry patch) {
        return registry.get(ownerId).getKnowledgeBase().update(id, patch);
    }

    public boolean deleteKnowledge(String ownerId, String id) {
        return registry.get(ownerId).getKnowledgeBase().delete(id);
    }

    public Optional<KnowledgeEntry> getKnowledge(String ownerId, String id) {
        return registry.get(ownerId).getKnowledgeBase().get(id);
    }

    public List<KnowledgeEntry> exportKnowledge(String ownerId) {
        return registry.get(ownerId).getKnowledgeBase().export();
    }

    public ImportReport importKnowledge(String ownerId, List<KnowledgeEntry> records, boolean overwrite) {
        return registry.get(ownerId).getKnowledgeBase().importRecords(records, overwrite);
    }

    public List<RelatedKnowledge> findRelated(String ownerId, String id, int maxDepth, double minConfidence) {
        return registry.get(ownerId).getGraph().findRelated(id, maxDepth, minConfidence);
    }

    /**
     * Record explicit feedback on an entry: feedback counters of the entry,
     * usage statistics and the user's category/source preferences.
     *
     * @return false if the entry does not exist
     */
    public boolean recordFeedback(String ownerId, String userId, String id, boolean positive) {
        OwnerMemoryContext context = registry.get(ownerId);
        if (!context.getKnowledgeBase().recordFeedback(id, positive)) {
            return false;
        }
        context.getUsageTracker().recordFeedback(id, positive);
        context.getKnowledgeBase().get(id)
                .ifPresent(entry -> context.getRecommender().updatePreference(userId, entry, positive));
        return true;
    }

    // ==================== Recommendation ====================

    public List<Recommendation> recommend(String ownerId, RecommendationContext recommendationContext, int k) {
        requireNonNegative(k);
        OwnerMemoryContext context = registry.get(ownerId);
        List<Recommendation> recommendations = context.getRecommender()
                .recommend(recommendationContext, context.getKnowledgeBase().all(), k);
        recommendations.forEach(recommendation -> context.getUsageTracker()
                .recordUsage(recommendation.entry().getId(), recommendationContext, UsageType.RECOMMENDATION));
        return recommendations;
    }

    /**
     * Knowledge worth surfacing unprompted. Empty unless one of the push
     * triggers fires and the user's cooldown has elapsed.
     */
    public List<PushedKnowledge> pushKnowledge(String ownerId, RecommendationContext recommendationContext,
            int k) {
        requireNonNegative(k);
        OwnerMemoryContext context = registry.get(ownerId);
        ProactiveKnowledgePusher pusher = context.getPusher();
        String userId = recommendationContext.getUserId();
        if (k == 0 || !pusher.shouldPush(userId, recommendationContext)) {
            return List.of();
        }
        List<PushedKnowledge> pushed = pusher.push(userId, recommendationContext,
                context.getKnowledgeBase().all(), k);
        pushed.forEach(item -> context.getUsageTracker()
                .recordUsage(item.entry().getId(), recommendationContext, UsageType.PUSH));
        if (!pushed.isEmpty()) {
            log.debug("[MemoryCore] Pushed {} entries to {}/{}", pushed.size(), ownerId, userId);
        }
        return pushed;
    }

    // ==================== Statistics ====================

    public MemoryStats getStats(String ownerId) {
        OwnerMemoryContext context = registry.get(ownerId);
        return new MemoryStats(ownerId,
                context.getMemoryManager().stats(),
                context.getCoreMemory().count(),
                context.getDiary().count(),
                context.getKnowledgeBase().statistics(),
                context.getGraph().statistics(),
                context.getUsageTracker().globalStats(),
                context.getCache().stats(),
                context.getRetriever().stats(),
                taskQueue.stats());
    }

    private static void requireNonNegative(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
    }

    public record MemoryStats(String ownerId, MemoryManager.Stats conversation, int coreMemories,
            int diaryEntries, KnowledgeStatistics knowledge, GraphStatistics graph,
            UsageStatistics.GlobalUsage usage, CacheLayer.Stats cache, ConcurrentRetriever.Stats retrieval,
            BackgroundTaskQueue.Stats tasks) {
    }
}
