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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProactiveKnowledgePusherTest {

    private static final double DELTA = 1e-9;

    private MutableClock clock;
    private ProactiveKnowledgePusher pusher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        pusher = new ProactiveKnowledgePusher(new MemoryProperties.PushProperties(), 100, clock);
    }

    @Test
    void shouldNotPushWithoutTrigger() {
        RecommendationContext context = RecommendationContext.builder()
                .topic("food")
                .recentTopics(List.of("food"))
                .build();

        assertFalse(pusher.shouldPush("alice", context));
    }

    @Test
    void shouldPushOnTopicChange() {
        RecommendationContext context = RecommendationContext.builder()
                .topic("food")
                .recentTopics(List.of("travel"))
                .build();

        assertTrue(pusher.shouldPush("alice", context));
    }

    @Test
    void shouldPushOnQuestion() {
        assertTrue(pusher.shouldPush("alice", RecommendationContext.builder()
                .userMessage("How hot should the water be?")
                .build()));
        assertTrue(pusher.shouldPush("alice", RecommendationContext.builder().userMessage("这是什么").build()));
    }

    @Test
    void shouldPushOnFollowUpButNotOnFiller() {
        RecommendationContext filler = RecommendationContext.builder()
                .lastUsedKnowledgeId("lore_1")
                .userMessage("Thanks!")
                .build();
        RecommendationContext followUp = filler.toBuilder().userMessage("tell me more about the brewing").build();

        assertFalse(pusher.shouldPush("alice", filler));
        assertTrue(pusher.shouldPush("alice", followUp));
    }

    @Test
    void shouldPushRelevantQualityEntriesOnlyOnce() {
        KnowledgeEntry relevant = entry("lore_1", "food", Set.of("tea"), 0.8);
        KnowledgeEntry lowQuality = entry("lore_2", "food", Set.of("tea"), 0.3);
        KnowledgeEntry unrelated = entry("lore_3", "history", Set.of("silk"), 0.9);
        RecommendationContext context = topicChange();
        List<KnowledgeEntry> entries = List.of(relevant, lowQuality, unrelated);

        List<PushedKnowledge> pushed = pusher.push("alice", context, entries, 5);

        assertEquals(1, pushed.size());
        assertEquals("lore_1", pushed.get(0).entry().getId());
        assertEquals(0.76, pushed.get(0).relevance(), DELTA);

        clock.advance(Duration.ofSeconds(301));
        assertTrue(pusher.push("alice", context, entries, 5).isEmpty());
        assertEquals(1, pusher.push("bob", context, entries, 5).size());
    }

    @Test
    void shouldRespectCooldown() {
        KnowledgeEntry first = entry("lore_1", "food", Set.of("tea"), 0.8);
        KnowledgeEntry second = entry("lore_4", "food", Set.of("tea"), 0.8);
        RecommendationContext context = topicChange();

        assertEquals(1, pusher.push("alice", context, List.of(first), 5).size());
        assertFalse(pusher.shouldPush("alice", context));
        assertTrue(pusher.push("alice", context, List.of(second), 5).isEmpty());

        clock.advance(Duration.ofSeconds(300));

        assertTrue(pusher.shouldPush("alice", context));
        assertEquals(1, pusher.push("alice", context, List.of(second), 5).size());
    }

    @Test
    void shouldCapKeywordContribution() {
        KnowledgeEntry entry = entry("lore_1", "food", Set.of("a", "b", "c", "d", "e"), null);
        RecommendationContext context = RecommendationContext.builder()
                .topic("other")
                .keywords(List.of("A", "b", "c", "d", "e"))
                .build();

        // 0.3 keyword cap + 0.2 * default quality 0.5
        assertEquals(0.4, ProactiveKnowledgePusher.relevance(entry, context), DELTA);
    }

    private static RecommendationContext topicChange() {
        return RecommendationContext.builder()
                .topic("food")
                .recentTopics(List.of("travel"))
                .keywords(List.of("tea"))
                .build();
    }

    private static KnowledgeEntry entry(String id, String category, Set<String> keywords, Double quality) {
        return KnowledgeEntry.builder()
                .id(id)
                .title(id)
                .content("content of " + id)
                .category(category)
                .keywords(keywords)
                .qualityScore(quality)
                .build();
    }
}
