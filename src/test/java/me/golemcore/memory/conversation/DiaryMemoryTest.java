package me.golemcore.memory.conversation;

import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.llm.LlmJsonClient;
import me.golemcore.memory.persistence.JsonDocumentStore;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiaryMemoryTest {

    private static final Instant NOON = Instant.parse("2026-05-05T12:00:00Z");

    private JsonDocumentStore<List<DiaryEntry>> store;
    private LlmJsonClient llm;
    private MutableClock clock;
    private MemoryProperties.DiaryProperties config;
    private DiaryMemory diary;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        store = mock(JsonDocumentStore.class);
        when(store.load()).thenReturn(new ArrayList<>());
        llm = mock(LlmJsonClient.class);
        clock = new MutableClock(NOON);
        config = new MemoryProperties.DiaryProperties();
        diary = new DiaryMemory(store, config, llm, clock);
        diary.load();
    }

    @Test
    void shouldPersistAcceptedEntry() {
        DiaryDecision decision = diary.addEntry(DiaryCandidate.of("Got the job offer today", 0.9, "happy"));

        assertEquals(DiaryDecision.SAVED, decision);
        assertEquals(1, diary.count());
        assertEquals(1, diary.writeVersion());
        verify(store).save(any());
    }

    @Test
    void shouldBufferRejectedInteractionsForSummary() {
        diary.addEntry(DiaryCandidate.of("Got the job offer today", 0.9, "happy"));

        assertEquals(DiaryDecision.TOO_SOON, diary.addEntry(DiaryCandidate.of("Nothing much going on", 0.2, null)));
        assertEquals(DiaryDecision.DUPLICATE, diary.addEntry(DiaryCandidate.of("Got the job offer today", 0.9,
                "happy")));

        assertEquals(List.of("Nothing much going on"), diary.dailyConversations());
    }

    @Test
    void shouldWriteRuleBasedSummaryOncePerDay() {
        diary.addEntry(DiaryCandidate.of("Got the job offer today", 0.9, "happy"));
        diary.addEntry(DiaryCandidate.of("Nothing much going on", 0.2, null));

        Optional<DiaryEntry> summary = diary.generateDailySummary(false);

        assertTrue(summary.isPresent());
        String content = summary.get().getContent();
        assertTrue(content.startsWith("Daily summary 2026-05-05: 2 conversations"), content);
        assertTrue(content.contains("Mood: happy x1"), content);
        assertTrue(content.contains("Got the job offer today"), content);
        assertEquals(DiaryMemory.SUMMARY_TOPIC, summary.get().getTopic());
        assertTrue(diary.dailyConversations().isEmpty());

        assertFalse(diary.generateDailySummary(false).isPresent());
        assertTrue(diary.generateDailySummary(true).isPresent());
    }

    @Test
    void shouldSkipSummaryOfEmptyDay() {
        assertFalse(diary.generateDailySummary(true).isPresent());
    }

    @Test
    void shouldUseModelSummaryWhenAvailable() {
        when(llm.isAvailable()).thenReturn(true);
        when(llm.completeText(eq("daily summary"), anyString())).thenReturn(Optional.of("  A good day.  "));
        diary.addEntry(DiaryCandidate.of("Got the job offer today", 0.9, "happy"));

        assertEquals("A good day.", diary.generateDailySummary(false).orElseThrow().getContent());
        verify(llm, atLeastOnce()).completeText(eq("daily summary"), anyString());
    }

    @Test
    void shouldFindEntriesByRelativeDay() {
        clock.set(NOON.minus(Duration.ofDays(1)));
        diary.addEntry(DiaryCandidate.of("Visited the science museum", 0.9, "excited"));
        clock.set(NOON.minus(Duration.ofDays(3)));
        diary.addEntry(DiaryCandidate.of("Baked bread with grandma", 0.9, "happy"));
        clock.set(NOON);
        diary.addEntry(DiaryCandidate.of("Finished the quarterly report", 0.9, "neutral"));

        assertEquals(List.of("Visited the science museum"), contents(diary.searchByTime("what did I do yesterday?",
                5)));
        assertEquals(List.of("Baked bread with grandma"), contents(diary.searchByTime("3 days ago", 5)));
        assertEquals(List.of("Finished the quarterly report", "Visited the science museum",
                "Baked bread with grandma"), contents(diary.searchByTime("last week", 5)));
    }

    @Test
    void shouldClampOversizedDayCountInTimeQuery() {
        clock.set(NOON.minus(Duration.ofDays(3650)));
        diary.addEntry(DiaryCandidate.of("Moved into the first apartment", 0.9, "happy"));
        clock.set(NOON);

        assertTrue(DiaryMemory.hasTimeKeyword("99999999999 days ago"));
        assertEquals(List.of("Moved into the first apartment"),
                contents(diary.searchByTime("about 99999999999 days ago", 5)));
    }

    @Test
    void shouldRestoreEntriesWhenWriteFails() {
        diary.addEntry(DiaryCandidate.of("Got the job offer today", 0.9, "happy"));
        doThrow(new IllegalStateException("disk full")).when(store).save(any());
        clock.advance(Duration.ofMinutes(5));

        assertThrows(IllegalStateException.class,
                () -> diary.addEntry(DiaryCandidate.of("Signed the lease for a new flat", 0.9, "excited")));

        assertEquals(1, diary.count());
        assertEquals(1, diary.writeVersion());
        assertEquals(List.of("Got the job offer today"), contents(diary.searchByTime("today", 5)));
    }

    @Test
    void shouldFallBackToContentSearchWithoutTimeKeyword() {
        diary.addEntry(DiaryCandidate.of("Visited the science museum", 0.9, "excited"));

        assertFalse(DiaryMemory.hasTimeKeyword("museum visit"));
        assertTrue(DiaryMemory.hasTimeKeyword("Recently I felt tired"));
        assertEquals(List.of("Visited the science museum"), contents(diary.searchByTime("museum", 5)));
        assertTrue(diary.searchByContent("volcano", 5).isEmpty());
    }

    @Test
    void shouldEvictLeastImportantUnprotectedEntries() {
        config.setMaxItems(2);
        diary.addEntry(DiaryCandidate.of("Wedding of my sister", 0.9, "happy"));
        clock.advance(Duration.ofMinutes(5));
        diary.addEntry(DiaryCandidate.of("Bought 2 new plants", 0.7, null));
        clock.advance(Duration.ofMinutes(5));
        diary.addEntry(DiaryCandidate.of("Exam result: 95 points", 0.75, null));

        assertEquals(List.of("Wedding of my sister", "Exam result: 95 points"), contents(diary.all()));
    }

    @Test
    void shouldDropOldEntriesUnlessProtected() {
        clock.set(NOON.minus(Duration.ofDays(400)));
        diary.addEntry(DiaryCandidate.of("Wedding of my sister", 0.9, "happy"));
        clock.advance(Duration.ofMinutes(5));
        diary.addEntry(DiaryCandidate.of("Bought 2 new plants", 0.7, null));
        clock.set(NOON);

        assertEquals(1, diary.prune());
        assertEquals(List.of("Wedding of my sister"), contents(diary.all()));
    }

    private static List<String> contents(List<DiaryEntry> entries) {
        return entries.stream().map(DiaryEntry::getContent).toList();
    }
}
