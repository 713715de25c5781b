package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.cache.CacheLayer;
import me.golemcore.memory.cache.LruTtlCache;
import me.golemcore.memory.conversation.CoreMemory;
import me.golemcore.memory.conversation.DiaryMemory;
import me.golemcore.memory.conversation.LongTermMemory;
import me.golemcore.memory.conversation.MemoryDeduplicator;
import me.golemcore.memory.conversation.MemoryManager;
import me.golemcore.memory.conversation.ShortTermMemory;
import me.golemcore.memory.conversation.VectorMemoryStore;
import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.graph.GraphDocument;
import me.golemcore.memory.graph.KnowledgeGraph;
import me.golemcore.memory.graph.LlmRelationExtractor;
import me.golemcore.memory.graph.RuleRelationExtractor;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.knowledge.KnowledgeBase;
import me.golemcore.memory.llm.LlmJsonClient;
import me.golemcore.memory.persistence.JsonDocumentStore;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.RemoteCachePort;
import me.golemcore.memory.port.outbound.StoragePort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import me.golemcore.memory.quality.ConflictDetector;
import me.golemcore.memory.quality.KnowledgeQualityManager;
import me.golemcore.memory.quality.KnowledgeScorer;
import me.golemcore.memory.quality.KnowledgeValidator;
import me.golemcore.memory.recommend.KnowledgeRecommender;
import me.golemcore.memory.recommend.KnowledgeUsageTracker;
import me.golemcore.memory.recommend.ProactiveKnowledgePusher;
import me.golemcore.memory.recommend.UsageStatistics;
import me.golemcore.memory.retrieval.ConcurrentRetriever;
import me.golemcore.memory.retrieval.EmbeddingStore;
import me.golemcore.memory.retrieval.MemorySource;
import me.golemcore.memory.retrieval.QueryExpander;
import me.golemcore.memory.retrieval.SourceBreakers;
import me.golemcore.memory.task.BackgroundTaskQueue;
import me.golemcore.memory.text.ContentHash;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Builds the {@link OwnerMemoryContext} of one owner: opens its JSON
 * documents, vector collections and caches and registers its retrieval
 * sources.
 *
 * <p>
 * Each owner gets a storage directory derived from its id. Ids that are not
 * safe as a directory name are sanitized and suffixed with a short hash of the
 * original id so that two different owners never share a directory.
 */
@Component
@Slf4j
public class OwnerContextFactory {

    static final String DIARY_FILE = "diary.json";
    static final String KNOWLEDGE_FILE = "lore_books.json";
    static final String GRAPH_FILE = "knowledge_graph.json";
    static final String LONG_TERM_FILE = "long_term_memory.json";
    static final String CORE_FILE = "core_memory.json";
    static final String USAGE_FILE = "knowledge_usage_stats.json";

    static final String SOURCE_LONG_TERM = "long_term";
    static final String SOURCE_CORE = "core";
    static final String SOURCE_DIARY = "diary";
    static final String SOURCE_KNOWLEDGE = "knowledge";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final int USAGE_TRACKER_FLUSH_EVERY = 20;

    private static final TypeReference<List<MemoryEntry>> MEMORY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<DiaryEntry>> DIARY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<KnowledgeEntry>> KNOWLEDGE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<GraphDocument> GRAPH = new TypeReference<>() {
    };
    private static final TypeReference<UsageStatistics> USAGE = new TypeReference<>() {
    };

    private final MemoryProperties properties;
    private final StoragePort storagePort;
    private final EmbeddingPort embeddingPort;
    private final VectorIndexPort vectorIndex;
    private final RemoteCachePort remoteCache;
    private final LlmJsonClient llm;
    private final BackgroundTaskQueue taskQueue;
    private final ExecutorService retrievalExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OwnerContextFactory(MemoryProperties properties, StoragePort storagePort, EmbeddingPort embeddingPort,
            VectorIndexPort vectorIndex, RemoteCachePort remoteCache, LlmJsonClient llm,
            BackgroundTaskQueue taskQueue, @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor,
            ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.storagePort = storagePort;
        this.embeddingPort = embeddingPort;
        this.vectorIndex = vectorIndex;
        this.remoteCache = remoteCache;
        this.llm = llm;
        this.taskQueue = taskQueue;
        this.retrievalExecutor = retrievalExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Create and load the context of one owner.
     */
    public OwnerMemoryContext create(String ownerId) {
        String directory = directoryFor(ownerId);
        MemoryProperties.RetrievalProperties retrieval = properties.getRetrieval();

        // ==================== Conversation ====================

        LongTermMemory longTerm = new LongTermMemory(
                new VectorMemoryStore(document(directory, LONG_TERM_FILE, MEMORY_LIST, ArrayList::new),
                        embeddings(ownerId, "long_term")),
                properties.getLongTerm(), ownerId, clock);
        longTerm.load();

        CoreMemory coreMemory = new CoreMemory(
                new VectorMemoryStore(document(directory, CORE_FILE, MEMORY_LIST, ArrayList::new),
                        embeddings(ownerId, "core")),
                properties.getCore(), ownerId, clock);
        coreMemory.load();

        MemoryManager memoryManager = new MemoryManager(
                new ShortTermMemory(properties.getShortTerm().getWindowPairs()), longTerm,
                new MemoryDeduplicator(properties.getDedup().getSimilarityThreshold(),
                        properties.getDedup().getMaxSeenHashes()),
                properties.getConsolidation(), taskQueue, clock);

        DiaryMemory diary = new DiaryMemory(document(directory, DIARY_FILE, DIARY_LIST, ArrayList::new),
                properties.getDiary(), llm, clock);
        diary.load();

        // ==================== Knowledge ====================

        CacheLayer cache = new CacheLayer(ownerId, new LruTtlCache<>(properties.getCache().getL1MaxSize(), clock),
                properties.getCache().getRemote().isEnabled() ? remoteCache : null, objectMapper);

        KnowledgeGraph graph = new KnowledgeGraph(document(directory, GRAPH_FILE, GRAPH, GraphDocument::new),
                new RuleRelationExtractor(properties.getGraph()),
                new LlmRelationExtractor(llm, properties.getGraph().getLlmBatchSize()), properties.getGraph(),
                clock);
        graph.load();

        KnowledgeScorer scorer = new KnowledgeScorer();
        KnowledgeQualityManager qualityManager = new KnowledgeQualityManager(scorer,
                new KnowledgeValidator(scorer, clock),
                new ConflictDetector(llm, properties.getQuality().isConflictDetection()), taskQueue,
                properties.getQuality().getLowScoreWarning());

        KnowledgeBase knowledgeBase = new KnowledgeBase(
                document(directory, KNOWLEDGE_FILE, KNOWLEDGE_LIST, ArrayList::new),
                embeddings(ownerId, "knowledge"), cache, graph, qualityManager, new QueryExpander(llm), taskQueue,
                properties, clock);
        knowledgeBase.load();

        KnowledgeUsageTracker usageTracker = new KnowledgeUsageTracker(
                document(directory, USAGE_FILE, USAGE, UsageStatistics::new), USAGE_TRACKER_FLUSH_EVERY, clock);
        usageTracker.load();

        // ==================== Retrieval ====================

        List<MemorySource> sources = List.of(
                MemorySource.of(SOURCE_LONG_TERM, (query, k) -> longTerm.search(query, k).stream()
                        .map(hit -> hit.entry().getContent())
                        .toList(), longTerm::writeVersion),
                MemorySource.of(SOURCE_CORE, (query, k) -> coreMemory.search(query, k, null).stream()
                        .map(hit -> hit.entry().getContent())
                        .toList(), coreMemory::writeVersion),
                MemorySource.of(SOURCE_DIARY, (query, k) -> (DiaryMemory.hasTimeKeyword(query)
                        ? diary.searchByTime(query, k)
                        : diary.searchByContent(query, k)).stream()
                        .map(DiaryEntry::getContent)
                        .toList(), diary::writeVersion),
                MemorySource.of(SOURCE_KNOWLEDGE, (query, k) -> knowledgeBase.search(query, k, null).stream()
                        .map(hit -> hit.entry().getTitle() + ": " + hit.entry().getContent())
                        .toList(), knowledgeBase::writeVersion));

        ConcurrentRetriever retriever = new ConcurrentRetriever(ownerId, sources,
                new SourceBreakers(ownerId, retrieval.getBreakerThreshold(),
                        Duration.ofMillis(retrieval.getBreakerCooldownMillis())),
                retrievalExecutor, retrieval, clock);

        log.info("[MemoryEngine] Opened owner '{}' in '{}': {} long-term, {} core, {} diary, {} knowledge",
                ownerId, directory, longTerm.count(), coreMemory.count(), diary.count(), knowledgeBase.count());

        return OwnerMemoryContext.builder()
                .ownerId(ownerId)
                .memoryManager(memoryManager)
                .longTerm(longTerm)
                .coreMemory(coreMemory)
                .diary(diary)
                .knowledgeBase(knowledgeBase)
                .graph(graph)
                .cache(cache)
                .retriever(retriever)
                .recommender(new KnowledgeRecommender(properties.getRecommend(), clock))
                .pusher(new ProactiveKnowledgePusher(properties.getPush(),
                        properties.getRecommend().getHistoryLimit(), clock))
                .usageTracker(usageTracker)
                .build();
    }

    /**
     * Storage directory of an owner.
     */
    static String directoryFor(String ownerId) {
        String sanitized = UNSAFE_CHARS.matcher(ownerId).replaceAll("_");
        if (sanitized.equals(ownerId) && !sanitized.startsWith(".")) {
            return sanitized;
        }
        return sanitized + "-" + ContentHash.md5(ownerId).substring(0, 8);
    }

    private <T> JsonDocumentStore<T> document(String directory, String fileName, TypeReference<T> type,
            Supplier<T> empty) {
        return new JsonDocumentStore<>(storagePort, objectMapper, directory, fileName, type, empty,
                properties.getStorage().isBackupOnWrite(), clock);
    }

    private EmbeddingStore embeddings(String ownerId, String kind) {
        return new EmbeddingStore(embeddingPort, vectorIndex, ownerId + ":" + kind,
                properties.getRetrieval().getDistanceMetric());
    }
}
