package me.golemcore.memory.conversation;

import me.golemcore.memory.domain.model.MemoryEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryDeduplicatorTest {

    @Test
    void shouldDetectRepeatedContent() {
        MemoryDeduplicator deduplicator = new MemoryDeduplicator(0.85, 100);

        assertTrue(deduplicator.checkAndAdd("I like tea"));
        assertFalse(deduplicator.checkAndAdd("I like tea"));
        assertTrue(deduplicator.isDuplicate("I like tea"));
    }

    @Test
    void shouldForgetOldestHashWhenFull() {
        MemoryDeduplicator deduplicator = new MemoryDeduplicator(0.85, 2);

        deduplicator.checkAndAdd("one");
        deduplicator.checkAndAdd("two");
        deduplicator.checkAndAdd("three");

        assertEquals(2, deduplicator.size());
        assertFalse(deduplicator.isDuplicate("one"));
        assertTrue(deduplicator.isDuplicate("three"));
    }

    @Test
    void shouldFindSimilarEntriesAboveThreshold() {
        MemoryDeduplicator deduplicator = new MemoryDeduplicator(0.85, 100);
        List<MemoryEntry> existing = List.of(
                MemoryEntry.builder().content("completely different").build(),
                MemoryEntry.builder().content("I like green tea").build());

        List<MemoryDeduplicator.SimilarMemory> similar = deduplicator.findSimilar("I like green tea", existing);

        assertEquals(1, similar.size());
        assertEquals(1, similar.get(0).index());
        assertEquals(1.0, similar.get(0).similarity());
    }

    @Test
    void shouldMergeKeepingMoreImportantEntry() {
        MemoryDeduplicator deduplicator = new MemoryDeduplicator(0.85, 100);
        MemoryEntry weak = MemoryEntry.builder().id("weak").content("tea").importance(0.2).usageCount(1).build();
        MemoryEntry strong = MemoryEntry.builder().id("strong").content("green tea").importance(0.8).usageCount(2)
                .metadata(Map.of("k", "v")).build();

        MemoryEntry merged = deduplicator.merge(weak, strong);

        assertEquals("strong", merged.getId());
        assertEquals(3, merged.getUsageCount());
        assertEquals(0.5, merged.getImportance(), 1e-9);
        assertEquals("weak", merged.getMetadata().get("merged_from"));
        assertEquals("v", merged.getMetadata().get("k"));
    }
}
