package me.golemcore.memory.conversation;

import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.text.ContentHash;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiaryFilterTest {

    private static final Instant NOW = Instant.parse("2026-05-05T12:00:00Z");

    private final MemoryProperties.DiaryProperties config = new MemoryProperties.DiaryProperties();
    private final DiaryFilter filter = new DiaryFilter(config);

    @Test
    void shouldRejectShortContent() {
        assertEquals(DiaryDecision.TOO_SHORT, evaluate(DiaryCandidate.of("ok", 1.0, null)));
    }

    @Test
    void shouldRejectExactDuplicateInWindow() {
        List<DiaryEntry> recent = List.of(entry("We climbed the mountain together"));

        assertEquals(DiaryDecision.DUPLICATE, filter.evaluate(
                DiaryCandidate.of("We climbed the mountain together", 0.9, "happy"), recent, 1, 0, null, NOW));
    }

    @Test
    void shouldIgnoreDuplicatesOutsideWindow() {
        config.setDedupWindow(1);
        List<DiaryEntry> recent = List.of(entry("We climbed the mountain together"), entry("Something else happened"));

        assertFalse(filter.isDuplicate("We climbed the mountain together", recent));
    }

    @Test
    void shouldStopAtDailyCap() {
        config.setDailyEntryCap(2);

        assertEquals(DiaryDecision.DAILY_CAP_REACHED, filter.evaluate(
                DiaryCandidate.of("A very important moment today", 1.0, null), List.of(), 2, 0, null, NOW));
    }

    @Test
    void shouldEnforceIntervalOnlyBelowImportanceThreshold() {
        Instant justBefore = NOW.minusSeconds(10);

        assertEquals(DiaryDecision.TOO_SOON, filter.evaluate(
                new DiaryCandidate("Met Anna for coffee", 0.5, null, List.of("Anna"), null, null),
                List.of(), 1, 0, justBefore, NOW));
        assertEquals(DiaryDecision.SAVED, filter.evaluate(
                DiaryCandidate.of("Got the job offer today", 0.9, null), List.of(), 1, 0, justBefore, NOW));
    }

    @Test
    void shouldSaveHappyEntriesUntilHappyCap() {
        DiaryCandidate happy = DiaryCandidate.of("Had a lovely afternoon", 0.65, "happy");

        assertEquals(DiaryDecision.SAVED, filter.evaluate(happy, List.of(), 0, 2, null, NOW));
        assertEquals(DiaryDecision.NOT_NOTABLE, filter.evaluate(happy, List.of(), 0, 3, null, NOW));
    }

    @Test
    void shouldSaveMentionsOfPeoplePlacesAndEvents() {
        assertTrue(filter.isNotable(new DiaryCandidate("Went out", 0.1, null, List.of(), "Paris", null),
                "Went out", 0));
        assertTrue(filter.isNotable(new DiaryCandidate("Went out", 0.1, null, List.of(), null, "concert"),
                "Went out", 0));
    }

    @Test
    void shouldSaveModerateNegativeEntries() {
        assertEquals(DiaryDecision.SAVED, evaluate(DiaryCandidate.of("Feeling low today", 0.45, "sad")));
        assertEquals(DiaryDecision.NOT_NOTABLE, evaluate(DiaryCandidate.of("Feeling low today", 0.2, "sad")));
        assertEquals(DiaryDecision.NOT_NOTABLE, evaluate(DiaryCandidate.of("Nothing much today", 0.5, "neutral")));
    }

    private DiaryDecision evaluate(DiaryCandidate candidate) {
        return filter.evaluate(candidate, List.of(), 0, 0, null, NOW);
    }

    private static DiaryEntry entry(String content) {
        return DiaryEntry.builder()
                .id(ContentHash.of(content))
                .content(content)
                .contentHash(ContentHash.of(content))
                .timestamp(NOW.minusSeconds(3600))
                .build();
    }
}
