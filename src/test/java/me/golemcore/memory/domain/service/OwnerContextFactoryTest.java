package me.golemcore.memory.domain.service;

import me.golemcore.memory.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.memory.adapter.outbound.vector.InMemoryVectorIndexAdapter;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.llm.LlmJsonClient;
import me.golemcore.memory.port.outbound.RemoteCachePort;
import me.golemcore.memory.task.BackgroundTaskQueue;
import me.golemcore.memory.testsupport.HashingEmbeddingPort;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class OwnerContextFactoryTest {

    @TempDir
    Path tempDir;

    private BackgroundTaskQueue taskQueue;
    private ExecutorService executor;
    private OwnerContextFactory factory;

    @BeforeEach
    void setUp() {
        taskQueue = new BackgroundTaskQueue(1, 100);
        executor = Executors.newFixedThreadPool(4);
        factory = new OwnerContextFactory(new MemoryProperties(), new LocalStorageAdapter(tempDir),
                new HashingEmbeddingPort(), new InMemoryVectorIndexAdapter(), mock(RemoteCachePort.class),
                mock(LlmJsonClient.class), taskQueue, executor, AutoConfiguration.objectMapper(),
                new MutableClock(Instant.parse("2026-03-10T12:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        taskQueue.shutdown();
    }

    @Test
    void shouldKeepSafeOwnerIds() {
        assertEquals("alice", OwnerContextFactory.directoryFor("alice"));
        assertEquals("team-1.bot_a", OwnerContextFactory.directoryFor("team-1.bot_a"));
    }

    @Test
    void shouldSanitizeUnsafeOwnerIdsWithoutCollisions() {
        String slash = OwnerContextFactory.directoryFor("a/b");
        String colon = OwnerContextFactory.directoryFor("a:b");

        assertTrue(slash.startsWith("a_b-"));
        assertTrue(colon.startsWith("a_b-"));
        assertNotEquals(slash, colon);
        assertTrue(OwnerContextFactory.directoryFor("..").startsWith("..-"));
    }

    @Test
    void shouldOpenOwnerWithAllRetrievalSources() {
        OwnerMemoryContext context = factory.create("alice");

        assertEquals("alice", context.getOwnerId());
        assertEquals(List.of("long_term", "core", "diary", "knowledge"), context.getRetriever().sourceNames());
        assertEquals(0, context.getKnowledgeBase().count());
    }

    @Test
    void shouldSearchCoreFactsThroughRetriever() {
        OwnerMemoryContext context = factory.create("alice");
        assertTrue(context.getCoreMemory().add("User likes green tea", "preference", 0.9));

        MemoryEngineRegistry registry = new MemoryEngineRegistry(mock(OwnerContextFactory.class),
                new MemoryProperties()) {
            @Override
            public OwnerMemoryContext get(String ownerId) {
                return context;
            }
        };
        MemoryCoreService service = new MemoryCoreService(registry, taskQueue);

        assertEquals(List.of("User likes green tea"), service.searchMemories("alice", "green tea", 3));
        assertTrue(Files.exists(tempDir.resolve("alice").resolve("core_memory.json")));
    }
}
