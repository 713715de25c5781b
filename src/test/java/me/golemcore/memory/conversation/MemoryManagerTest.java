package me.golemcore.memory.conversation;

import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.task.BackgroundTaskQueue;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryManagerTest {

    private static final String IMPORTANT_USER = "Please remember my birthday is in May, I am so happy";

    private LongTermMemory longTerm;
    private BackgroundTaskQueue taskQueue;
    private MemoryProperties.ConsolidationProperties config;
    private MemoryManager manager;

    @BeforeEach
    void setUp() {
        longTerm = mock(LongTermMemory.class);
        when(longTerm.add(anyString(), anyDouble(), anyMap(), anyBoolean())).thenReturn(true);
        when(longTerm.addAll(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        taskQueue = new BackgroundTaskQueue(1, 10);
        config = new MemoryProperties.ConsolidationProperties();
        config.setAutoEnabled(false);
        manager = new MemoryManager(new ShortTermMemory(10), longTerm, new MemoryDeduplicator(0.85, 100), config,
                taskQueue, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        taskQueue.shutdown();
    }

    @Test
    void shouldSkipLowImportanceExchanges() {
        assertFalse(manager.addInteractionLongTerm("hi", "hello", 0.1));

        verify(longTerm, never()).add(anyString(), anyDouble(), anyMap(), anyBoolean());
    }

    @Test
    void shouldStoreFormattedExchangeOnce() {
        assertTrue(manager.addInteractionLongTerm("hi", "hello", 0.5));
        assertFalse(manager.addInteractionLongTerm("hi", "hello", 0.5));

        verify(longTerm, times(1)).add(eq("User: hi\nAssistant: hello"), eq(0.5), anyMap(), eq(true));
    }

    @Test
    void shouldKeepExchangeInShortTermWindow() {
        manager.addInteraction("hi", "hello", false, null);

        assertEquals(2, manager.recentMessages().size());
        verify(longTerm, never()).add(anyString(), anyDouble(), anyMap(), anyBoolean());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPromoteOnlyImportantExchanges() {
        manager.addInteraction(IMPORTANT_USER, "I will remember that", false, null);
        manager.addInteraction("ok", "fine", false, null);

        assertEquals(1, manager.consolidate());

        ArgumentCaptor<List<MemoryEntry>> captor = ArgumentCaptor.forClass(List.class);
        verify(longTerm).addAll(captor.capture());
        assertEquals(1, captor.getValue().size());
        assertTrue(captor.getValue().get(0).getContent().startsWith("User: " + IMPORTANT_USER));
        assertEquals("true", captor.getValue().get(0).getMetadata().get("consolidated"));

        assertEquals(0, manager.consolidate());
    }

    @Test
    void shouldConsolidateInBackgroundEveryNInteractions() {
        config.setAutoEnabled(true);
        config.setAutoEvery(2);

        manager.addInteraction(IMPORTANT_USER, "I will remember that", false, null);
        verify(longTerm, never()).addAll(anyList());
        manager.addInteraction("ok", "fine", false, null);

        assertTrue(taskQueue.awaitIdle(Duration.ofSeconds(5)));
        verify(longTerm, times(1)).addAll(anyList());
    }
}
