package me.golemcore.memory.conversation;

import com.fasterxml.jackson.core.type.TypeReference;
import me.golemcore.memory.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.memory.adapter.outbound.vector.InMemoryVectorIndexAdapter;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.persistence.JsonDocumentStore;
import me.golemcore.memory.retrieval.EmbeddingStore;
import me.golemcore.memory.testsupport.HashingEmbeddingPort;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreMemoryTest {

    private static final TypeReference<List<MemoryEntry>> MEMORY_LIST = new TypeReference<>() {
    };

    @TempDir
    Path tempDir;

    private CoreMemory coreMemory;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-02-01T10:00:00Z"));
        JsonDocumentStore<List<MemoryEntry>> document = new JsonDocumentStore<>(new LocalStorageAdapter(tempDir),
                AutoConfiguration.objectMapper(), "owner1", "core_memory.json", MEMORY_LIST, ArrayList::new, false,
                clock);
        EmbeddingStore embeddings = new EmbeddingStore(new HashingEmbeddingPort(), new InMemoryVectorIndexAdapter(),
                "owner1:core", MemoryProperties.DistanceMetric.BOUNDED);
        coreMemory = new CoreMemory(new VectorMemoryStore(document, embeddings),
                new MemoryProperties.CoreMemoryProperties(), "owner1", clock);
        coreMemory.load();
    }

    @Test
    void shouldRejectDuplicateFacts() {
        assertTrue(coreMemory.add("Lives in Berlin", "personal_info", 0.8));
        assertFalse(coreMemory.add("lives in  berlin", "personal_info", 0.8));
        assertEquals(1, coreMemory.count());
    }

    @Test
    void shouldFilterSearchByCategory() {
        coreMemory.add("Favourite drink is green tea", "preferences", 0.8);
        coreMemory.add("Drinks green tea at work", "habits", 0.8);

        List<CoreMemory.CoreHit> hits = coreMemory.search("green tea", 5, "preferences");

        assertEquals(1, hits.size());
        assertEquals("Favourite drink is green tea", hits.get(0).entry().getContent());
    }

    @Test
    void shouldDefaultCategory() {
        coreMemory.add("Has a cat named Tom", null, 0.8);

        assertEquals(CoreMemory.DEFAULT_CATEGORY, coreMemory.all().get(0).getMetadata().get("category"));
        assertEquals(1, coreMemory.search("cat named Tom", 3, CoreMemory.DEFAULT_CATEGORY).size());
    }
}
