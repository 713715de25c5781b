package me.golemcore.memory.quality;

import me.golemcore.memory.domain.model.KnowledgeEntry;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KnowledgeScorerTest {

    private static final double DELTA = 1e-9;

    private final KnowledgeScorer scorer = new KnowledgeScorer();

    @Test
    void shouldScoreNewShortManualEntry() {
        KnowledgeEntry entry = KnowledgeEntry.builder().title("Tea").content("Tea.").source("manual").build();

        // 0.25 * 0 + 0.3 * 0.5 + 0.3 * (0.3 + 1.0 + 0.5) / 3 + 0.15 * 0.9
        assertEquals(0.465, scorer.score(entry), DELTA);
    }

    @Test
    void shouldSaturateUsageAtOneHundred() {
        assertEquals(0.0, scorer.usageScore(KnowledgeEntry.builder().usageCount(0).build()), DELTA);
        assertEquals(1.0, scorer.usageScore(KnowledgeEntry.builder().usageCount(99).build()), DELTA);
        assertEquals(1.0, scorer.usageScore(KnowledgeEntry.builder().usageCount(5000).build()), DELTA);
    }

    @Test
    void shouldUsePositiveFeedbackRatio() {
        assertEquals(0.5, scorer.feedbackScore(KnowledgeEntry.builder().build()), DELTA);
        assertEquals(0.75, scorer.feedbackScore(KnowledgeEntry.builder()
                .positiveFeedback(3)
                .negativeFeedback(1)
                .build()), DELTA);
    }

    @Test
    void shouldRewardStructuredContentWithKeywords() {
        KnowledgeEntry entry = KnowledgeEntry.builder()
                .content("Green tea steeps best at eighty degrees, never boiling.")
                .keywords(Set.of("tea"))
                .build();

        assertEquals(1.0, scorer.contentScore(entry), DELTA);
    }

    @Test
    void shouldScoreKnownAndUnknownSources() {
        assertEquals(0.9, scorer.sourceScore(KnowledgeEntry.builder().build()), DELTA);
        assertEquals(0.7, scorer.sourceScore(KnowledgeEntry.builder().source("file").build()), DELTA);
        assertEquals(0.5, scorer.sourceScore(KnowledgeEntry.builder().source("web").build()), DELTA);
    }
}
