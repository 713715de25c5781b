package me.golemcore.memory.recommend;

import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeRecommenderTest {

    private static final double DELTA = 1e-9;

    private MutableClock clock;
    private MemoryProperties.RecommendProperties config;
    private KnowledgeRecommender recommender;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        config = new MemoryProperties.RecommendProperties();
        recommender = new KnowledgeRecommender(config, clock);
    }

    @Test
    void shouldRankTopicMatchesFirstAndDropWeakOnes() {
        KnowledgeEntry food = entry("a", "Green tea", "Green tea steeps best at eighty degrees.", "food");
        KnowledgeEntry history = entry("b", "Silk road", "Caravans crossed the desert.", "history");
        RecommendationContext context = RecommendationContext.builder().topic("food").build();

        List<Recommendation> recommendations = recommender.recommend(context, List.of(history, food), 5);

        assertEquals(1, recommendations.size());
        assertEquals("a", recommendations.get(0).entry().getId());
        assertTrue(recommendations.get(0).reasons().contains("highly relevant to topic 'food'"));
    }

    @Test
    void shouldKeepEverythingWithZeroMinimumScore() {
        KnowledgeEntry food = entry("a", "Green tea", "Green tea steeps best at eighty degrees.", "food");
        KnowledgeEntry history = entry("b", "Silk road", "Caravans crossed the desert.", "history");
        RecommendationContext context = RecommendationContext.builder().topic("food").build();

        List<Recommendation> recommendations = recommender.recommend(context, List.of(history, food), 5, 0.0);

        assertEquals(List.of("a", "b"), recommendations.stream().map(r -> r.entry().getId()).toList());
        assertTrue(recommendations.get(0).score() > recommendations.get(1).score());
    }

    @Test
    void shouldReturnNothingForEmptyInput() {
        RecommendationContext context = RecommendationContext.ofQuery("tea");

        assertTrue(recommender.recommend(context, List.of(), 5).isEmpty());
        assertTrue(recommender.recommend(context,
                List.of(entry("a", "Green tea", "Green tea.", "food")), 0).isEmpty());
    }

    @Test
    void shouldScoreTopicRelevance() {
        KnowledgeEntry entry = entry("a", "Green tea", "Green tea steeps best at eighty degrees.", "food");

        assertEquals(1.0, KnowledgeRecommender.topicRelevance(entry, "FOOD", List.of()), DELTA);
        assertEquals(0.8, KnowledgeRecommender.topicRelevance(entry, "tea", List.of()), DELTA);
        assertEquals(0.2, KnowledgeRecommender.topicRelevance(entry, "music", List.of("eighty")), DELTA);
        assertEquals(0.0, KnowledgeRecommender.topicRelevance(entry, null, List.of("tea")), DELTA);
    }

    @Test
    void shouldScoreKeywordMatch() {
        KnowledgeEntry entry = entry("a", "Green tea", "Green tea steeps best at eighty degrees.", "food");

        assertEquals(0.5, KnowledgeRecommender.keywordMatch(entry, List.of("tea", "rice"), null), DELTA);
        assertEquals(0.6, KnowledgeRecommender.keywordMatch(entry, List.of("tea", "rice"), "green tea"), DELTA);
        assertEquals(0.0, KnowledgeRecommender.keywordMatch(entry, List.of(), null), DELTA);
    }

    @Test
    void shouldDecayRecencyLinearly() {
        KnowledgeEntry entry = entry("a", "Green tea", "Green tea.", "food");
        entry.setLastUsed(clock.instant().minus(Duration.ofDays(3)));

        assertEquals(0.7, KnowledgeRecommender.recency(entry, clock.instant()), DELTA);

        entry.setLastUsed(clock.instant().minus(Duration.ofDays(20)));
        assertEquals(0.0, KnowledgeRecommender.recency(entry, clock.instant()), DELTA);

        assertEquals(0.5, KnowledgeRecommender.recency(new KnowledgeEntry(), clock.instant()), DELTA);
    }

    @Test
    void shouldLearnPreferencesFromFeedback() {
        KnowledgeEntry entry = entry("a", "Green tea", "Green tea.", "food");

        recommender.updatePreference("alice", entry, true);
        recommender.updatePreference("alice", entry, true);

        assertEquals(0.7, recommender.preferenceFor("alice", entry), DELTA);
        assertEquals(0.5, recommender.preferenceFor("bob", entry), DELTA);

        for (int i = 0; i < 10; i++) {
            recommender.updatePreference("alice", entry, false);
        }
        assertEquals(0.0, recommender.preferenceFor("alice", entry), DELTA);
    }

    @Test
    void shouldBoundRecommendationHistory() {
        config.setHistoryLimit(2);
        KnowledgeEntry entry = entry("a", "Green tea", "Green tea.", "food");
        RecommendationContext context = RecommendationContext.builder().topic("food").build();

        for (int i = 0; i < 3; i++) {
            recommender.recommend(context, List.of(entry), 1);
        }

        assertEquals(2, recommender.history().size());
        assertTrue(recommender.history().get(0).scores().containsKey("a"));
    }

    private KnowledgeEntry entry(String id, String title, String content, String category) {
        return KnowledgeEntry.builder()
                .id(id)
                .title(title)
                .content(content)
                .category(category)
                .keywords(Set.of(title.toLowerCase().split(" ")))
                .source("manual")
                .timestamp(clock.instant())
                .build();
    }
}
