package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.knowledge.KnowledgeBase;
import me.golemcore.memory.knowledge.KnowledgeHit;
import me.golemcore.memory.recommend.KnowledgeRecommender;
import me.golemcore.memory.recommend.KnowledgeUsageTracker;
import me.golemcore.memory.recommend.ProactiveKnowledgePusher;
import me.golemcore.memory.recommend.PushedKnowledge;
import me.golemcore.memory.recommend.Recommendation;
import me.golemcore.memory.recommend.RecommendationContext;
import me.golemcore.memory.recommend.UsageType;
import me.golemcore.memory.retrieval.ConcurrentRetriever;
import me.golemcore.memory.task.BackgroundTaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MemoryCoreServiceTest {

    private static final String OWNER = "alice";

    private ConcurrentRetriever retriever;
    private KnowledgeBase knowledgeBase;
    private KnowledgeUsageTracker usageTracker;
    private KnowledgeRecommender recommender;
    private ProactiveKnowledgePusher pusher;
    private MemoryCoreService service;

    @BeforeEach
    void setUp() {
        retriever = mock(ConcurrentRetriever.class);
        knowledgeBase = mock(KnowledgeBase.class);
        usageTracker = mock(KnowledgeUsageTracker.class);
        recommender = mock(KnowledgeRecommender.class);
        pusher = mock(ProactiveKnowledgePusher.class);
        OwnerMemoryContext context = OwnerMemoryContext.builder()
                .ownerId(OWNER)
                .retriever(retriever)
                .knowledgeBase(knowledgeBase)
                .usageTracker(usageTracker)
                .recommender(recommender)
                .pusher(pusher)
                .build();
        MemoryEngineRegistry registry = mock(MemoryEngineRegistry.class);
        when(registry.get(OWNER)).thenReturn(context);
        service = new MemoryCoreService(registry, mock(BackgroundTaskQueue.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldMergeMemorySourcesInFixedOrder() {
        when(retriever.retrieve(anyString(), any(Map.class), anyBoolean())).thenReturn(Map.of(
                "diary", List.of("diary entry"),
                "long_term", List.of("long-term memory", "core fact"),
                "core", List.of("core fact")));

        List<String> memories = service.searchMemories(OWNER, "tea", 5);

        assertEquals(List.of("core fact", "long-term memory", "diary entry"), memories);
        ArgumentCaptor<Map<String, Integer>> perSourceK = ArgumentCaptor.forClass(Map.class);
        verify(retriever).retrieve(eq("tea"), perSourceK.capture(), eq(true));
        assertEquals(Map.of("core", 5, "long_term", 5, "diary", 5, "knowledge", 0), perSourceK.getValue());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldLimitMergedMemories() {
        when(retriever.retrieve(anyString(), any(Map.class), anyBoolean())).thenReturn(Map.of(
                "core", List.of("a", "b"),
                "long_term", List.of("c", "d")));

        assertEquals(List.of("a", "b", "c"), service.searchMemories(OWNER, "tea", 3));
    }

    @Test
    void shouldValidateK() {
        assertThrows(IllegalArgumentException.class, () -> service.searchMemories(OWNER, "tea", -1));
        assertThrows(IllegalArgumentException.class, () -> service.searchKnowledge(OWNER, "tea", -1, null));
        assertTrue(service.searchMemories(OWNER, "tea", 0).isEmpty());
        verifyNoInteractions(retriever);
    }

    @Test
    void shouldTrackSearchUsage() {
        KnowledgeEntry entry = KnowledgeEntry.builder().id("lore_1").title("Tea").content("Tea.").build();
        when(knowledgeBase.search("tea", 3, null)).thenReturn(List.of(new KnowledgeHit(entry, 0.9, null, null)));

        List<KnowledgeHit> hits = service.searchKnowledge(OWNER, "tea", 3, null);

        assertEquals(1, hits.size());
        verify(usageTracker).recordUsage(eq("lore_1"), any(RecommendationContext.class), eq(UsageType.SEARCH));
    }

    @Test
    void shouldApplyFeedbackToEntryTrackerAndPreferences() {
        KnowledgeEntry entry = KnowledgeEntry.builder().id("lore_1").category("food").source("manual").build();
        when(knowledgeBase.recordFeedback("lore_1", true)).thenReturn(true);
        when(knowledgeBase.get("lore_1")).thenReturn(Optional.of(entry));

        assertTrue(service.recordFeedback(OWNER, "bob", "lore_1", true));

        verify(usageTracker).recordFeedback("lore_1", true);
        verify(recommender).updatePreference("bob", entry, true);
    }

    @Test
    void shouldIgnoreFeedbackForMissingEntry() {
        when(knowledgeBase.recordFeedback("lore_missing", false)).thenReturn(false);

        assertFalse(service.recordFeedback(OWNER, "bob", "lore_missing", false));

        verifyNoInteractions(usageTracker, recommender);
    }

    @Test
    void shouldTrackRecommendations() {
        KnowledgeEntry entry = KnowledgeEntry.builder().id("lore_1").build();
        RecommendationContext context = RecommendationContext.builder().topic("food").build();
        when(knowledgeBase.all()).thenReturn(List.of(entry));
        when(recommender.recommend(context, List.of(entry), 2))
                .thenReturn(List.of(new Recommendation(entry, 0.6, List.of())));

        assertEquals(1, service.recommend(OWNER, context, 2).size());

        verify(usageTracker).recordUsage("lore_1", context, UsageType.RECOMMENDATION);
    }

    @Test
    void shouldNotPushWithoutTrigger() {
        RecommendationContext context = RecommendationContext.builder().topic("food").build();
        when(pusher.shouldPush("default", context)).thenReturn(false);

        assertTrue(service.pushKnowledge(OWNER, context, 3).isEmpty());

        verify(pusher, never()).push(anyString(), any(), any(), anyInt());
        verify(knowledgeBase, never()).all();
    }

    @Test
    void shouldTrackPushes() {
        KnowledgeEntry entry = KnowledgeEntry.builder().id("lore_1").build();
        RecommendationContext context = RecommendationContext.builder().userId("bob").topic("food").build();
        when(pusher.shouldPush("bob", context)).thenReturn(true);
        when(knowledgeBase.all()).thenReturn(List.of(entry));
        when(pusher.push("bob", context, List.of(entry), 3)).thenReturn(List.of(new PushedKnowledge(entry, 0.7)));

        assertEquals(1, service.pushKnowledge(OWNER, context, 3).size());

        verify(usageTracker).recordUsage("lore_1", context, UsageType.PUSH);
    }
}
